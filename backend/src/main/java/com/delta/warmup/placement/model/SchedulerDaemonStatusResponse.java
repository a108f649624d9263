package com.delta.warmup.placement.model;

import java.time.Instant;

public record SchedulerDaemonStatusResponse(
    boolean running,
    long cyclesCompleted,
    Instant lastCycleAt,
    int scheduledEntries,
    int runningEntries
) {
}
