package com.delta.warmup.placement.api;

import java.time.Instant;

public record ScheduleTestRequest(
    String domainId,
    Instant scheduledFor
) {
}
