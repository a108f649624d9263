package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.ScheduledEntry;
import com.delta.warmup.placement.model.ScheduledEntryStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "warmup.persistence", name = "mode", havingValue = "memory")
public class InMemoryScheduleStore implements ScheduleStore {
    private final Map<String, ScheduledEntry> entries = new ConcurrentHashMap<>();

    @Override
    public ScheduledEntry get(String id) {
        return id == null ? null : entries.get(id);
    }

    @Override
    public void set(ScheduledEntry entry) {
        entries.put(entry.id(), entry);
    }

    @Override
    public boolean delete(String id) {
        return id != null && entries.remove(id) != null;
    }

    @Override
    public List<ScheduledEntry> listByStatus(ScheduledEntryStatus status) {
        return entries.values().stream()
            .filter(entry -> entry.status() == status)
            .sorted(Comparator.comparing(ScheduledEntry::scheduledFor))
            .toList();
    }
}
