package com.delta.warmup.placement.model;

import java.time.Instant;

public record TestHistoryEntry(
    String testId,
    int score,
    ProviderType provider,
    Instant timestamp
) {
}
