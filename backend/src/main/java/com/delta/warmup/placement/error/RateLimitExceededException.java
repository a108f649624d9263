package com.delta.warmup.placement.error;

import java.time.Duration;

public class RateLimitExceededException extends WarmupException {
    private final Duration retryAfter;

    public RateLimitExceededException(String message, Duration retryAfter) {
        super(ErrorKind.RATE_LIMIT_EXCEEDED, message);
        this.retryAfter = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    public Duration retryAfter() {
        return retryAfter;
    }
}
