package com.delta.warmup.placement.api;

public record ProviderCredentialsRequest(String apiKey) {
}
