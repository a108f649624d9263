package com.delta.warmup.placement.error;

public class ProviderTransportException extends WarmupException {
    public enum Reason {
        NETWORK(true),
        TIMEOUT(true),
        RATE_LIMITED(true),
        SERVER_ERROR(true),
        MALFORMED_RESPONSE(false);

        private final boolean retryable;

        Reason(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean retryable() {
            return retryable;
        }
    }

    private final String provider;
    private final Reason reason;

    public ProviderTransportException(String provider, Reason reason, String message) {
        super(ErrorKind.PROVIDER_TRANSPORT, message);
        this.provider = provider;
        this.reason = reason;
    }

    public String provider() {
        return provider;
    }

    public Reason reason() {
        return reason;
    }

    public boolean isRetryable() {
        return reason != null && reason.retryable();
    }
}
