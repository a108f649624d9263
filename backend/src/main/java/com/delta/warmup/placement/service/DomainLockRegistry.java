package com.delta.warmup.placement.service;

import com.delta.warmup.placement.error.OperationCancelledException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-domain critical section. Locks are reentrant so lifecycle operations may nest.
 */
@Component
public class DomainLockRegistry {
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String domainId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(domainId, ignored -> new ReentrantLock());
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting for domain " + domainId, e);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
