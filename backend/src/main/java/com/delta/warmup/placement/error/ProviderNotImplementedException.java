package com.delta.warmup.placement.error;

public class ProviderNotImplementedException extends WarmupException {
    private final String provider;

    public ProviderNotImplementedException(String provider, String operation) {
        super(ErrorKind.NOT_IMPLEMENTED, provider + " does not support " + operation);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
