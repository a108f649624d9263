package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.ScheduledEntry;
import com.delta.warmup.placement.model.ScheduledEntryStatus;

import java.util.List;

/**
 * Keyed store of scheduled placement tests. {@link #set} inserts or replaces by id.
 */
public interface ScheduleStore {
    ScheduledEntry get(String id);

    void set(ScheduledEntry entry);

    boolean delete(String id);

    List<ScheduledEntry> listByStatus(ScheduledEntryStatus status);
}
