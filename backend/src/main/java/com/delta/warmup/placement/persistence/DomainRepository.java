package com.delta.warmup.placement.persistence;

import com.delta.warmup.placement.model.Domain;

import java.time.Instant;
import java.util.List;

public interface DomainRepository {
    Domain findById(String id);

    List<Domain> findByOwner(String ownerId);

    /**
     * Domains that are not inactive and whose next test is due at or before {@code now}, oldest first.
     */
    List<Domain> findDueForTesting(Instant now, int limit);

    boolean existsByOwnerAndName(String ownerId, String name);

    void insert(Domain domain);

    void update(Domain domain);

    /**
     * Writes new test times only if the stored {@code lastTestAt} still equals {@code expectedLastTestAt}.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSetTestTimes(String id, Instant expectedLastTestAt, Instant newLastTestAt, Instant newNextTestAt);
}
