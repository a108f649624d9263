package com.delta.warmup.placement.api;

public record SubmitTestRequest(
    String domainId,
    String provider
) {
}
