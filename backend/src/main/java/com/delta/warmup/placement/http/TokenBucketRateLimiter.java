package com.delta.warmup.placement.http;

import com.delta.warmup.placement.error.OperationCancelledException;
import com.delta.warmup.placement.error.RateLimitExceededException;
import com.delta.warmup.placement.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket limiter with one global bucket plus a lazily created bucket per key.
 * A caller must pass both; each bucket is refilled on access and updated under its own monitor.
 * Waiting callers hold a reserved token and sleep outside the monitor.
 */
public class TokenBucketRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final String name;
    private final int capacity;
    private final double refillPerInterval;
    private final long intervalMs;
    private final long maxWaitMs;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Bucket globalBucket;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketRateLimiter(
        String name,
        int capacity,
        double refillPerInterval,
        long intervalMs,
        long maxWaitMs,
        Clock clock,
        Sleeper sleeper
    ) {
        if (capacity < 1 || refillPerInterval <= 0 || intervalMs < 1 || maxWaitMs < 0) {
            throw new IllegalArgumentException("invalid rate limit configuration for " + name);
        }
        this.name = name;
        this.capacity = capacity;
        this.refillPerInterval = refillPerInterval;
        this.intervalMs = intervalMs;
        this.maxWaitMs = maxWaitMs;
        this.clock = clock;
        this.sleeper = sleeper;
        this.globalBucket = new Bucket(capacity, clock.instant());
    }

    public void acquire() {
        long waitMs = reserve(globalBucket, "global");
        await(waitMs, globalBucket, null);
    }

    public void acquire(String key) {
        if (key == null || key.isBlank()) {
            acquire();
            return;
        }
        long globalWaitMs = reserve(globalBucket, "global");
        Bucket bucket = buckets.computeIfAbsent(key, ignored -> new Bucket(capacity, clock.instant()));
        long keyWaitMs;
        try {
            keyWaitMs = reserve(bucket, key);
        } catch (RateLimitExceededException e) {
            refund(globalBucket);
            throw e;
        }
        await(Math.max(globalWaitMs, keyWaitMs), globalBucket, bucket);
    }

    public double availableTokens(String key) {
        Bucket bucket = key == null ? globalBucket : buckets.get(key);
        if (bucket == null) {
            return capacity;
        }
        synchronized (bucket) {
            refill(bucket);
            return bucket.tokens;
        }
    }

    /**
     * Takes one token, going into debt when the bucket is empty, and returns how long the caller must wait
     * for that token. Later callers see the debt, so every caller's wait is bounded by {@code maxWaitMs}.
     */
    private long reserve(Bucket bucket, String key) {
        synchronized (bucket) {
            refill(bucket);
            if (bucket.tokens >= 1.0) {
                bucket.tokens -= 1.0;
                return 0;
            }
            long waitMs = (long) Math.ceil((1.0 - bucket.tokens) * intervalMs / refillPerInterval);
            if (waitMs > maxWaitMs) {
                throw new RateLimitExceededException(
                    "Rate limit exceeded for " + name + " (" + key + ")",
                    Duration.ofMillis(waitMs)
                );
            }
            bucket.tokens -= 1.0;
            return waitMs;
        }
    }

    private void await(long waitMs, Bucket global, Bucket keyed) {
        if (waitMs <= 0) {
            return;
        }
        log.debug("Rate limiter {} waiting {}ms", name, waitMs);
        try {
            sleeper.sleep(Duration.ofMillis(waitMs));
        } catch (InterruptedException e) {
            refund(global);
            if (keyed != null) {
                refund(keyed);
            }
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting for rate limiter " + name, e);
        }
    }

    private void refund(Bucket bucket) {
        synchronized (bucket) {
            refill(bucket);
            bucket.tokens = Math.min(capacity, bucket.tokens + 1.0);
        }
    }

    private void refill(Bucket bucket) {
        Instant now = clock.instant();
        long elapsedMs = Duration.between(bucket.lastRefill, now).toMillis();
        if (elapsedMs <= 0) {
            return;
        }
        bucket.tokens = Math.min(capacity, bucket.tokens + (elapsedMs / (double) intervalMs) * refillPerInterval);
        bucket.lastRefill = now;
    }

    private static final class Bucket {
        private double tokens;
        private Instant lastRefill;

        private Bucket(double tokens, Instant lastRefill) {
            this.tokens = tokens;
            this.lastRefill = lastRefill;
        }
    }
}
