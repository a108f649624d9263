package com.delta.warmup.placement.model;

public record Placements(
    double inboxPct,
    double spamPct,
    double otherPct
) {
    public static Placements empty() {
        return new Placements(0.0, 0.0, 0.0);
    }
}
