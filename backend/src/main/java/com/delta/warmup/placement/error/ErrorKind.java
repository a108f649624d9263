package com.delta.warmup.placement.error;

public enum ErrorKind {
    VALIDATION("validation_error"),
    INVALID_TRANSITION("invalid_transition"),
    RATE_LIMIT_EXCEEDED("rate_limit_exceeded"),
    QUOTA_EXCEEDED("quota_exceeded"),
    PROVIDER_TRANSPORT("provider_transport_error"),
    PROVIDER_AUTH("provider_auth_error"),
    NOT_IMPLEMENTED("not_implemented"),
    NOT_FOUND("not_found"),
    CANCELLED("cancelled");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
