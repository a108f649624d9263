package com.delta.warmup.placement.model;

public enum HealthStatus {
    HEALTHY,
    WARNING,
    CRITICAL
}
