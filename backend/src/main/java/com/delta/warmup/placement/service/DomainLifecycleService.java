package com.delta.warmup.placement.service;

import com.delta.warmup.placement.error.InvalidTransitionException;
import com.delta.warmup.placement.error.NotFoundException;
import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.model.Domain;
import com.delta.warmup.placement.model.DomainStatus;
import com.delta.warmup.placement.model.LifecycleSignals;
import com.delta.warmup.placement.model.ProviderType;
import com.delta.warmup.placement.model.TestHistoryEntry;
import com.delta.warmup.placement.model.TestSummary;
import com.delta.warmup.placement.persistence.DomainRepository;
import com.delta.warmup.placement.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
public class DomainLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(DomainLifecycleService.class);

    private final DomainRepository domains;
    private final LifecyclePolicy policy;
    private final DomainLockRegistry locks;
    private final Clock clock;

    public DomainLifecycleService(
        DomainRepository domains,
        LifecyclePolicy policy,
        DomainLockRegistry locks,
        Clock clock
    ) {
        this.domains = domains;
        this.policy = policy;
        this.locks = locks;
        this.clock = clock;
    }

    public Domain register(String ownerId, String name, int maxSendVolume, Integer requestedDailyVolume) {
        requireOwner(ownerId);
        if (!DomainNames.isValid(name)) {
            throw new ValidationException("Invalid domain name: " + name);
        }
        if (maxSendVolume < 0) {
            throw new ValidationException("maxSendVolume must not be negative");
        }
        if (requestedDailyVolume != null && requestedDailyVolume < 0) {
            throw new ValidationException("dailySendVolume must not be negative");
        }
        String normalized = DomainNames.normalize(name);
        if (domains.existsByOwnerAndName(ownerId, normalized)) {
            throw new ValidationException("Domain " + normalized + " is already registered");
        }
        int cap = policy.volumeCap(DomainStatus.WARMING, maxSendVolume);
        int daily = requestedDailyVolume == null ? cap : Math.min(requestedDailyVolume, cap);
        Instant now = now();
        Domain domain = new Domain(
            UUID.randomUUID().toString(),
            ownerId,
            normalized,
            DomainStatus.WARMING,
            daily,
            maxSendVolume,
            null,
            now,
            now,
            List.of()
        );
        domains.insert(domain);
        log.info("Registered domain {} for owner {} (cap {} of {})", normalized, ownerId, daily, maxSendVolume);
        return domain;
    }

    public Domain getDomain(String ownerId, String domainId) {
        requireOwner(ownerId);
        Domain domain = domains.findById(domainId);
        if (domain == null || !Objects.equals(domain.ownerId(), ownerId)) {
            throw new NotFoundException("Domain " + domainId + " not found");
        }
        return domain;
    }

    public List<Domain> listDomains(String ownerId) {
        requireOwner(ownerId);
        return domains.findByOwner(ownerId);
    }

    public Domain transition(String ownerId, String domainId, DomainStatus target) {
        if (target == null) {
            throw new ValidationException("Target status is required");
        }
        getDomain(ownerId, domainId);
        return locks.withLock(domainId, () -> {
            Domain current = reload(domainId);
            if (!policy.isAllowed(current.status(), target)) {
                throw new InvalidTransitionException(current.status(), target);
            }
            Domain updated = moveTo(current, target);
            domains.update(updated);
            log.info("Domain {} moved {} -> {}", current.name(), current.status(), target);
            return updated;
        });
    }

    public Domain resetToWarming(String ownerId, String domainId) {
        getDomain(ownerId, domainId);
        return locks.withLock(domainId, () -> {
            Domain current = reload(domainId);
            if (current.status() == DomainStatus.WARMING) {
                throw new InvalidTransitionException(current.status(), DomainStatus.WARMING);
            }
            Domain updated = moveTo(current, DomainStatus.WARMING);
            domains.update(updated);
            log.info("Domain {} reset to WARMING from {}", current.name(), current.status());
            return updated;
        });
    }

    public LifecycleSignals evaluate(String ownerId, String domainId) {
        return policy.evaluate(getDomain(ownerId, domainId));
    }

    public Domain applySignals(String ownerId, String domainId) {
        getDomain(ownerId, domainId);
        return locks.withLock(domainId, () -> {
            Domain current = reload(domainId);
            LifecycleSignals signals = policy.evaluate(current);
            if (signals.shouldGraduate()) {
                current = transition(ownerId, domainId, DomainStatus.ACTIVE);
            } else if (signals.shouldDeactivate()) {
                current = transition(ownerId, domainId, DomainStatus.INACTIVE);
            }
            if (current.status() != DomainStatus.INACTIVE) {
                // Re-evaluate: graduation raises the cap the increase is measured against.
                LifecycleSignals afterTransition = policy.evaluate(current);
                if (afterTransition.shouldIncreaseVolume()) {
                    current = adjustVolume(current, afterTransition.recommendedVolume());
                }
            }
            return current;
        });
    }

    public Domain recordSummary(String domainId, String testId, ProviderType provider, TestSummary summary) {
        return locks.withLock(domainId, () -> {
            Domain current = reload(domainId);
            boolean alreadyRecorded = current.testHistory().stream()
                .anyMatch(entry -> Objects.equals(entry.testId(), testId));
            if (alreadyRecorded) {
                return current;
            }
            TestHistoryEntry entry = new TestHistoryEntry(testId, summary.score(), provider, summary.timestamp());
            Domain updated = current.withHistoryEntry(entry, policy.historyLimit());
            domains.update(updated);
            return updated;
        });
    }

    public int volumeCap(Domain domain) {
        return policy.volumeCap(domain);
    }

    public Duration cadence(DomainStatus status) {
        return policy.cadence(status);
    }

    public Instant nextTestAt(DomainStatus status, Instant from) {
        return policy.nextTestAt(status, from);
    }

    private Domain moveTo(Domain current, DomainStatus target) {
        int cap = policy.volumeCap(target, current.maxSendVolume());
        int volume = target == DomainStatus.WARMING ? cap : Math.min(current.dailySendVolume(), cap);
        Domain moved = current.withStatus(target, volume, nextTestAfterChange(current, target));
        if (volume != current.dailySendVolume()) {
            moved = moved.withVolume(volume, now(), moved.nextTestAt());
        }
        return moved;
    }

    private Domain adjustVolume(Domain current, int newVolume) {
        Instant now = now();
        Domain updated = current.withVolume(newVolume, now, nextTestAfterChange(current, current.status()));
        domains.update(updated);
        log.info("Domain {} daily volume {} -> {}", current.name(), current.dailySendVolume(), newVolume);
        return updated;
    }

    private Instant nextTestAfterChange(Domain current, DomainStatus status) {
        Instant base = current.lastTestAt() == null ? now() : current.lastTestAt();
        return policy.nextTestAt(status, base);
    }

    private Domain reload(String domainId) {
        Domain domain = domains.findById(domainId);
        if (domain == null) {
            throw new NotFoundException("Domain " + domainId + " not found");
        }
        return domain;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner id is required");
        }
    }
}
