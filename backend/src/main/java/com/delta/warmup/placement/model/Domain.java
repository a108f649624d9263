package com.delta.warmup.placement.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public record Domain(
    String id,
    String ownerId,
    String name,
    DomainStatus status,
    int dailySendVolume,
    int maxSendVolume,
    Instant lastTestAt,
    Instant nextTestAt,
    Instant volumeAdjustedAt,
    List<TestHistoryEntry> testHistory
) {
    public Domain {
        if (maxSendVolume < 0) {
            throw new IllegalArgumentException("maxSendVolume must not be negative");
        }
        if (dailySendVolume < 0 || dailySendVolume > maxSendVolume) {
            throw new IllegalArgumentException(
                "dailySendVolume " + dailySendVolume + " outside [0, " + maxSendVolume + "]"
            );
        }
        testHistory = testHistory == null ? List.of() : List.copyOf(testHistory);
    }

    public TestHistoryEntry latestTest() {
        return testHistory.isEmpty() ? null : testHistory.get(testHistory.size() - 1);
    }

    public Domain withStatus(DomainStatus newStatus, int newDailySendVolume, Instant newNextTestAt) {
        return new Domain(id, ownerId, name, newStatus, newDailySendVolume, maxSendVolume,
            lastTestAt, newNextTestAt, volumeAdjustedAt, testHistory);
    }

    public Domain withVolume(int newDailySendVolume, Instant adjustedAt, Instant newNextTestAt) {
        return new Domain(id, ownerId, name, status, newDailySendVolume, maxSendVolume,
            lastTestAt, newNextTestAt, adjustedAt, testHistory);
    }

    public Domain withTestTimes(Instant newLastTestAt, Instant newNextTestAt) {
        return new Domain(id, ownerId, name, status, dailySendVolume, maxSendVolume,
            newLastTestAt, newNextTestAt, volumeAdjustedAt, testHistory);
    }

    public Domain withHistoryEntry(TestHistoryEntry entry, int limit) {
        List<TestHistoryEntry> history = new ArrayList<>(testHistory);
        history.add(entry);
        int overflow = history.size() - Math.max(1, limit);
        if (overflow > 0) {
            history = history.subList(overflow, history.size());
        }
        return new Domain(id, ownerId, name, status, dailySendVolume, maxSendVolume,
            lastTestAt, nextTestAt, volumeAdjustedAt, history);
    }
}
