package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.PlacementTest;
import com.delta.warmup.placement.model.PlacementTestStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(prefix = "warmup.persistence", name = "mode", havingValue = "memory")
public class InMemoryPlacementTestRepository implements PlacementTestRepository {
    private final Map<String, PlacementTest> tests = new ConcurrentHashMap<>();

    @Override
    public PlacementTest findById(String id) {
        return id == null ? null : tests.get(id);
    }

    @Override
    public void save(PlacementTest test) {
        tests.put(test.id(), test);
    }

    @Override
    public int countCreatedSince(String ownerId, Instant since) {
        return (int) tests.values().stream()
            .filter(test -> Objects.equals(test.ownerId(), ownerId))
            .filter(test -> !test.createdAt().isBefore(since))
            .count();
    }

    @Override
    public List<PlacementTest> findByStatuses(Collection<PlacementTestStatus> statuses, int limit) {
        return tests.values().stream()
            .filter(test -> statuses.contains(test.status()))
            .sorted(Comparator.comparing(PlacementTest::createdAt))
            .limit(Math.max(1, limit))
            .toList();
    }
}
