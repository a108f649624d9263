package com.delta.warmup.config;

import com.delta.warmup.placement.http.RetryExecutor;
import com.delta.warmup.placement.http.TokenBucketRateLimiter;
import com.delta.warmup.placement.util.Sleeper;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class WarmupConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.system();
    }

    @Bean(name = "submissionRateLimiter")
    public TokenBucketRateLimiter submissionRateLimiter(WarmupProperties properties, Clock clock, Sleeper sleeper) {
        WarmupProperties.RateLimit rateLimit = properties.getRateLimit();
        return new TokenBucketRateLimiter(
            "submissions",
            rateLimit.getMaxRequestsPerInterval(),
            rateLimit.getMaxRequestsPerInterval(),
            rateLimit.getIntervalMs(),
            rateLimit.getMaxWaitMs(),
            clock,
            sleeper
        );
    }

    @Bean
    public RetryExecutor retryExecutor(WarmupProperties properties, Sleeper sleeper) {
        WarmupProperties.Retry retry = properties.getRetry();
        return new RetryExecutor(
            retry.getMaxRetries(),
            retry.getInitialBackoffMs(),
            retry.getBackoffMultiplier(),
            retry.getMaxBackoffMs(),
            sleeper
        );
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(WarmupProperties properties) {
        int size = Math.max(2, properties.getHttp().getMaxConcurrentRequests());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
