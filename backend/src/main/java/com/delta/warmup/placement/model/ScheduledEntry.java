package com.delta.warmup.placement.model;

import java.time.Instant;

public record ScheduledEntry(
    String id,
    String domainId,
    Instant scheduledFor,
    ScheduledEntryStatus status,
    String placementTestId,
    String lastError,
    Instant createdAt
) {
    public ScheduledEntry withStatus(ScheduledEntryStatus newStatus) {
        return new ScheduledEntry(id, domainId, scheduledFor, newStatus, placementTestId, lastError, createdAt);
    }

    public ScheduledEntry running(String testId) {
        return new ScheduledEntry(id, domainId, scheduledFor, ScheduledEntryStatus.RUNNING, testId, null, createdAt);
    }

    public ScheduledEntry failed(String error) {
        return new ScheduledEntry(id, domainId, scheduledFor, ScheduledEntryStatus.CANCELLED, placementTestId, error,
            createdAt);
    }
}
