package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.PlacementTest;
import com.delta.warmup.placement.model.PlacementTestStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface PlacementTestRepository {
    PlacementTest findById(String id);

    void save(PlacementTest test);

    int countCreatedSince(String ownerId, Instant since);

    List<PlacementTest> findByStatuses(Collection<PlacementTestStatus> statuses, int limit);
}
