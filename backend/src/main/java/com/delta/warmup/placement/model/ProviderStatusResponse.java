package com.delta.warmup.placement.model;

public record ProviderStatusResponse(
    String provider,
    boolean enabled,
    boolean apiKeyConfigured,
    boolean halted
) {
}
