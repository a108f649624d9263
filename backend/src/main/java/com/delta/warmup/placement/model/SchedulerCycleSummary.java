package com.delta.warmup.placement.model;

public record SchedulerCycleSummary(
    int entriesScheduled,
    int testsSubmitted,
    int submissionsFailed,
    int testsCompleted,
    int testsStillPending
) {
}
