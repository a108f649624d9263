package com.delta.warmup.placement.error;

public class ProviderAuthException extends WarmupException {
    private final String provider;

    public ProviderAuthException(String provider, String message) {
        super(ErrorKind.PROVIDER_AUTH, message);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
