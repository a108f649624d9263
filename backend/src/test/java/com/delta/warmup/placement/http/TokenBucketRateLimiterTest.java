package com.delta.warmup.placement.http;

import com.delta.warmup.placement.MutableClock;
import com.delta.warmup.placement.error.OperationCancelledException;
import com.delta.warmup.placement.error.RateLimitExceededException;
import com.delta.warmup.placement.util.Sleeper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketRateLimiterTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper advancingSleeper = duration -> {
        sleeps.add(duration);
        clock.advance(duration);
    };

    @Test
    void sixtyImmediateAcquisitionsThenTheNextWaitsLessThanOneInterval() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 60, 60, 1000, 30_000, clock, advancingSleeper);

        for (int i = 0; i < 60; i++) {
            limiter.acquire("domain:example.com");
        }
        assertThat(sleeps).isEmpty();

        limiter.acquire("domain:example.com");

        assertThat(sleeps).hasSize(1);
        assertThat(sleeps.get(0).toMillis()).isGreaterThan(0).isLessThanOrEqualTo(1000);
    }

    @Test
    void failsInsteadOfWaitingLongerThanMaxWait() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 2, 1, 10_000, 500, clock, advancingSleeper);
        limiter.acquire("k");
        limiter.acquire("k");

        assertThatThrownBy(() -> limiter.acquire("k"))
            .isInstanceOf(RateLimitExceededException.class)
            .satisfies(error -> assertThat(((RateLimitExceededException) error).retryAfter())
                .isEqualTo(Duration.ofMillis(10_000)));
        assertThat(sleeps).isEmpty();
    }

    @Test
    void refillsLazilyFromElapsedTime() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 10, 10, 1000, 0, clock, advancingSleeper);
        for (int i = 0; i < 10; i++) {
            limiter.acquire();
        }
        assertThatThrownBy(limiter::acquire).isInstanceOf(RateLimitExceededException.class);

        clock.advance(Duration.ofMillis(500));
        assertThat(limiter.availableTokens(null)).isEqualTo(5.0);

        clock.advance(Duration.ofSeconds(10));
        assertThat(limiter.availableTokens(null)).isEqualTo(10.0);
    }

    @Test
    void globalBucketIsSharedAcrossKeysWhileKeyBucketsAreIndependent() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 2, 1, 60_000, 0, clock, advancingSleeper);

        limiter.acquire("domain:a.com");
        limiter.acquire("domain:b.com");

        assertThat(limiter.availableTokens("domain:a.com")).isEqualTo(1.0);
        assertThat(limiter.availableTokens("domain:c.com")).isEqualTo(2.0);
        assertThatThrownBy(() -> limiter.acquire("domain:c.com")).isInstanceOf(RateLimitExceededException.class);
    }

    @Test
    void secondConsumeAfterWaitingIsUnconditional() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 1, 1, 1000, 5000, clock, advancingSleeper);
        limiter.acquire();
        limiter.acquire();

        assertThat(sleeps).containsExactly(Duration.ofMillis(1000));
        assertThat(limiter.availableTokens(null)).isEqualTo(0.0);
    }

    @Test
    void interruptedWaitIsReportedAsCancellation() {
        Sleeper interrupting = duration -> {
            throw new InterruptedException("stop");
        };
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 1, 1, 1000, 5000, clock, interrupting);
        limiter.acquire();

        try {
            assertThatThrownBy(limiter::acquire).isInstanceOf(OperationCancelledException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void interruptedWaitReturnsTheReservedTokens() {
        Sleeper interrupting = duration -> {
            throw new InterruptedException("stop");
        };
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("test", 1, 1, 1000, 5000, clock, interrupting);
        limiter.acquire("domain:a.com");

        try {
            assertThatThrownBy(() -> limiter.acquire("domain:a.com")).isInstanceOf(OperationCancelledException.class);
        } finally {
            Thread.interrupted();
        }

        assertThat(limiter.availableTokens(null)).isEqualTo(0.0);
        assertThat(limiter.availableTokens("domain:a.com")).isEqualTo(0.0);
    }

    @Test
    void concurrentWaitersNeverBlockLongerThanMaxWait() throws Exception {
        long maxWaitMs = 250;
        TokenBucketRateLimiter limiter =
            new TokenBucketRateLimiter("test", 1, 1, 200, maxWaitMs, Clock.systemUTC(), Sleeper.system());
        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicLong longestBlockMs = new AtomicLong();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    long began = System.nanoTime();
                    try {
                        limiter.acquire("domain:example.com");
                    } catch (RateLimitExceededException e) {
                        rejected.incrementAndGet();
                    }
                    longestBlockMs.accumulateAndGet(
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - began), Math::max);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(rejected.get()).isGreaterThanOrEqualTo(threads - 2);
        assertThat(longestBlockMs.get()).isLessThan(maxWaitMs + 200);
    }
}
