package com.delta.warmup.placement.api;

public record RegisterDomainRequest(
    String name,
    Integer maxSendVolume,
    Integer dailySendVolume
) {
}
