package com.delta.warmup.placement.model;

import java.time.Instant;
import java.util.List;

public record TestSummary(
    int score,
    Placements placements,
    List<String> recommendations,
    Instant timestamp
) {
    public TestSummary {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within 0..100");
        }
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
