package com.delta.warmup.placement.http;

import com.delta.warmup.placement.error.OperationCancelledException;
import com.delta.warmup.placement.error.ProviderTransportException;
import com.delta.warmup.placement.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final double backoffMultiplier;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public RetryExecutor(int maxAttempts, long initialBackoffMs, double backoffMultiplier, long maxBackoffMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.backoffMultiplier = Math.max(1.0, backoffMultiplier);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (ProviderTransportException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                long delayMs = backoffFor(attempt);
                log.warn(
                    "{} failed on attempt {}/{} ({}), retrying in {}ms",
                    operation,
                    attempt,
                    maxAttempts,
                    e.reason(),
                    delayMs
                );
                try {
                    sleeper.sleep(Duration.ofMillis(delayMs));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new OperationCancelledException(operation + " cancelled during retry backoff", ie);
                }
                attempt++;
            }
        }
    }

    long backoffFor(int attempt) {
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, Math.max(0, attempt - 1));
        return (long) Math.min(maxBackoffMs, delay);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
