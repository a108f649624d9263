package com.delta.warmup.placement.model;

public record LifecycleSignals(
    String domainId,
    DomainStatus status,
    Integer latestScore,
    int healthScore,
    HealthStatus health,
    boolean rotationEligible,
    boolean shouldGraduate,
    boolean shouldDeactivate,
    boolean shouldIncreaseVolume,
    int recommendedVolume,
    int volumeCap
) {
}
