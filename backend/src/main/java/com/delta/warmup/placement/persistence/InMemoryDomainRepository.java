package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.Domain;
import com.delta.warmup.placement.model.DomainStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

@Repository
@ConditionalOnProperty(prefix = "warmup.persistence", name = "mode", havingValue = "memory")
public class InMemoryDomainRepository implements DomainRepository {
    private final Map<String, Domain> domains = new ConcurrentHashMap<>();

    @Override
    public Domain findById(String id) {
        return id == null ? null : domains.get(id);
    }

    @Override
    public List<Domain> findByOwner(String ownerId) {
        return domains.values().stream()
            .filter(domain -> Objects.equals(domain.ownerId(), ownerId))
            .sorted(Comparator.comparing(Domain::name))
            .toList();
    }

    @Override
    public List<Domain> findDueForTesting(Instant now, int limit) {
        return domains.values().stream()
            .filter(domain -> domain.status() != DomainStatus.INACTIVE)
            .filter(domain -> domain.nextTestAt() != null && !domain.nextTestAt().isAfter(now))
            .sorted(Comparator.comparing(Domain::nextTestAt))
            .limit(Math.max(1, limit))
            .toList();
    }

    @Override
    public boolean existsByOwnerAndName(String ownerId, String name) {
        return domains.values().stream()
            .anyMatch(domain -> Objects.equals(domain.ownerId(), ownerId) && Objects.equals(domain.name(), name));
    }

    @Override
    public void insert(Domain domain) {
        if (domains.putIfAbsent(domain.id(), domain) != null) {
            throw new IllegalStateException("Domain " + domain.id() + " already exists");
        }
    }

    @Override
    public void update(Domain domain) {
        if (domains.replace(domain.id(), domain) == null) {
            throw new IllegalStateException("Domain " + domain.id() + " does not exist");
        }
    }

    @Override
    public boolean compareAndSetTestTimes(
        String id,
        Instant expectedLastTestAt,
        Instant newLastTestAt,
        Instant newNextTestAt
    ) {
        AtomicBoolean swapped = new AtomicBoolean(false);
        domains.computeIfPresent(id, (key, current) -> {
            if (!Objects.equals(current.lastTestAt(), expectedLastTestAt)) {
                return current;
            }
            swapped.set(true);
            return current.withTestTimes(newLastTestAt, newNextTestAt);
        });
        return swapped.get();
    }
}
