package com.delta.warmup.placement.model;

public enum ScheduledEntryStatus {
    SCHEDULED,
    RUNNING,
    COMPLETED,
    CANCELLED
}
