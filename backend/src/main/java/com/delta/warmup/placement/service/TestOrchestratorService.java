package com.delta.warmup.placement.service;

import com.delta.warmup.config.WarmupProperties;
import com.delta.warmup.placement.error.NotFoundException;
import com.delta.warmup.placement.error.QuotaExceededException;
import com.delta.warmup.placement.error.RateLimitExceededException;
import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.error.WarmupException;
import com.delta.warmup.placement.http.RetryExecutor;
import com.delta.warmup.placement.http.TokenBucketRateLimiter;
import com.delta.warmup.placement.model.DeliveryStatus;
import com.delta.warmup.placement.model.Domain;
import com.delta.warmup.placement.model.DomainStatus;
import com.delta.warmup.placement.model.PlacementTest;
import com.delta.warmup.placement.model.PlacementTestStatus;
import com.delta.warmup.placement.model.ProviderTestCreation;
import com.delta.warmup.placement.model.ProviderTestResults;
import com.delta.warmup.placement.model.ScheduledEntry;
import com.delta.warmup.placement.model.ScheduledEntryStatus;
import com.delta.warmup.placement.model.SubmittedTest;
import com.delta.warmup.placement.model.TestEmailOutcome;
import com.delta.warmup.placement.model.TestSummary;
import com.delta.warmup.placement.persistence.DomainRepository;
import com.delta.warmup.placement.persistence.PlacementTestRepository;
import com.delta.warmup.placement.persistence.ScheduleStore;
import com.delta.warmup.placement.provider.PlacementProviderClient;
import com.delta.warmup.placement.provider.PlacementProviderRegistry;
import com.delta.warmup.placement.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Submits placement tests under the spacing, quota and rate-limit rules and turns provider results into
 * summaries. Every write to a domain's test times happens inside that domain's lock.
 */
@Service
public class TestOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(TestOrchestratorService.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final DomainRepository domains;
    private final PlacementTestRepository tests;
    private final ScheduleStore scheduleStore;
    private final PlacementProviderRegistry providers;
    private final DomainLifecycleService lifecycle;
    private final LifecyclePolicy policy;
    private final DomainLockRegistry locks;
    private final TokenBucketRateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final WarmupProperties properties;
    private final Clock clock;

    public TestOrchestratorService(
        DomainRepository domains,
        PlacementTestRepository tests,
        ScheduleStore scheduleStore,
        PlacementProviderRegistry providers,
        DomainLifecycleService lifecycle,
        LifecyclePolicy policy,
        DomainLockRegistry locks,
        @Qualifier("submissionRateLimiter") TokenBucketRateLimiter rateLimiter,
        RetryExecutor retryExecutor,
        WarmupProperties properties,
        Clock clock
    ) {
        this.domains = domains;
        this.tests = tests;
        this.scheduleStore = scheduleStore;
        this.providers = providers;
        this.lifecycle = lifecycle;
        this.policy = policy;
        this.locks = locks;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public SubmittedTest submitTest(String ownerId, String domainId, String providerKey) {
        PlacementProviderClient client = providers.resolve(providerKey);
        Domain domain = lifecycle.getDomain(ownerId, domainId);
        if (!DomainNames.isValid(domain.name())) {
            throw new ValidationException("Invalid domain name: " + domain.name());
        }
        checkTestable(domain, now());

        rateLimiter.acquire("domain:" + domain.name());

        return locks.withLock(domainId, () -> {
            Domain current = domains.findById(domainId);
            if (current == null) {
                throw new NotFoundException("Domain " + domainId + " not found");
            }
            checkTestable(current, now());

            ProviderTestCreation creation = retryExecutor.execute(
                client.type().key() + " createTest",
                () -> client.createTest(current.name())
            );

            Instant submittedAt = now();
            Instant nextTestAt = policy.nextTestAt(current.status(), submittedAt);
            boolean swapped = domains.compareAndSetTestTimes(
                domainId,
                current.lastTestAt(),
                submittedAt,
                nextTestAt
            );
            if (!swapped) {
                throw new RateLimitExceededException(
                    "Another test was submitted for " + current.name() + " concurrently",
                    policy.minimumSpacing()
                );
            }

            List<TestEmailOutcome> seeded = creation.testAddresses().stream()
                .map(address -> new TestEmailOutcome(address, DeliveryStatus.NOT_RECEIVED, null))
                .toList();
            PlacementTest test = new PlacementTest(
                UUID.randomUUID().toString(),
                domainId,
                current.ownerId(),
                client.type(),
                creation.testId(),
                PlacementTestStatus.CREATED,
                creation.seedPhrase(),
                seeded,
                null,
                submittedAt,
                submittedAt
            );
            tests.save(test);
            log.info(
                "Submitted {} placement test {} for domain {} (provider id {})",
                client.type().key(),
                test.id(),
                current.name(),
                creation.testId()
            );
            return new SubmittedTest(test, nextTestAt, policy.volumeCap(current));
        });
    }

    public TestSummary pollResults(String testId) {
        PlacementTest test = getTest(testId);
        if (test.status() == PlacementTestStatus.COMPLETED) {
            return test.summary();
        }
        if (test.status() == PlacementTestStatus.FAILED || test.status() == PlacementTestStatus.CANCELLED) {
            return null;
        }

        PlacementProviderClient client = providers.resolve(test.provider());
        ProviderTestResults results = retryExecutor.execute(
            client.type().key() + " getResults",
            () -> client.getResults(test.providerTestId())
        );

        return locks.withLock(test.domainId(), () -> {
            PlacementTest current = getTest(testId);
            if (current.status() == PlacementTestStatus.COMPLETED) {
                return current.summary();
            }
            if (current.status().isTerminal()) {
                return null;
            }
            Instant now = now();
            List<TestEmailOutcome> outcomes = results.testAddresses().isEmpty()
                ? current.outcomes()
                : results.testAddresses();

            if (results.status() == PlacementTestStatus.FAILED) {
                tests.save(current.withProgress(PlacementTestStatus.FAILED, outcomes, now));
                log.warn("Placement test {} failed at provider {}", testId, current.provider().key());
                return null;
            }
            if (results.status() != PlacementTestStatus.COMPLETED) {
                tests.save(current.withProgress(PlacementTestStatus.IN_PROGRESS, outcomes, now));
                return null;
            }

            TestSummary summary = PlacementScoring.summarize(results.overallScore(), outcomes, now);
            tests.save(current.completed(outcomes, summary, now));
            lifecycle.recordSummary(current.domainId(), current.id(), current.provider(), summary);
            log.info(
                "Placement test {} completed with score {} (inbox {}%, spam {}%)",
                testId,
                summary.score(),
                summary.placements().inboxPct(),
                summary.placements().spamPct()
            );
            return summary;
        });
    }

    public PlacementTest getTest(String testId) {
        PlacementTest test = testId == null ? null : tests.findById(testId);
        if (test == null) {
            throw new NotFoundException("Placement test " + testId + " not found");
        }
        return test;
    }

    public PlacementTest getTest(String ownerId, String testId) {
        PlacementTest test = getTest(testId);
        if (!Objects.equals(test.ownerId(), ownerId)) {
            throw new NotFoundException("Placement test " + testId + " not found");
        }
        return test;
    }

    public ScheduledEntry scheduleTest(String ownerId, String domainId, Instant scheduledFor) {
        Domain domain = lifecycle.getDomain(ownerId, domainId);
        if (scheduledFor == null || !scheduledFor.isAfter(now())) {
            throw new ValidationException("scheduledFor must be in the future");
        }
        if (domain.status() == DomainStatus.INACTIVE) {
            throw new ValidationException("Domain " + domain.name() + " is inactive and is not tested");
        }
        return enqueue(domain, scheduledFor);
    }

    public List<ScheduledEntry> listScheduledTests() {
        return scheduleStore.listByStatus(ScheduledEntryStatus.SCHEDULED);
    }

    public ScheduledEntry cancelScheduledTest(String entryId) {
        ScheduledEntry entry = scheduleStore.get(entryId);
        if (entry == null) {
            throw new NotFoundException("Scheduled test " + entryId + " not found");
        }
        return locks.withLock(entry.domainId(), () -> {
            ScheduledEntry current = scheduleStore.get(entryId);
            if (current == null) {
                throw new NotFoundException("Scheduled test " + entryId + " not found");
            }
            if (current.status() == ScheduledEntryStatus.CANCELLED) {
                return current;
            }
            if (current.status() == ScheduledEntryStatus.COMPLETED) {
                throw new ValidationException("Scheduled test " + entryId + " already completed");
            }
            if (current.placementTestId() != null) {
                cancelPlacementTest(current.placementTestId());
            }
            ScheduledEntry cancelled = current.withStatus(ScheduledEntryStatus.CANCELLED);
            scheduleStore.set(cancelled);
            log.info("Cancelled scheduled test {} for domain {}", entryId, current.domainId());
            return cancelled;
        });
    }

    ScheduledEntry enqueue(Domain domain, Instant scheduledFor) {
        return locks.withLock(domain.id(), () -> {
            for (ScheduledEntry existing : scheduleStore.listByStatus(ScheduledEntryStatus.SCHEDULED)) {
                if (existing.domainId().equals(domain.id())) {
                    scheduleStore.set(existing.withStatus(ScheduledEntryStatus.CANCELLED));
                    log.info("Superseded scheduled test {} for domain {}", existing.id(), domain.name());
                }
            }
            ScheduledEntry entry = new ScheduledEntry(
                UUID.randomUUID().toString(),
                domain.id(),
                scheduledFor,
                ScheduledEntryStatus.SCHEDULED,
                null,
                null,
                now()
            );
            scheduleStore.set(entry);
            return entry;
        });
    }

    /**
     * Starts a due scheduled entry. Returns the submitted test, or null when the entry was no longer
     * runnable or the submission was rejected (the rejection is stored on the entry).
     */
    PlacementTest runScheduledEntry(String entryId, String providerKey) {
        ScheduledEntry entry = scheduleStore.get(entryId);
        if (entry == null || entry.status() != ScheduledEntryStatus.SCHEDULED) {
            return null;
        }
        Domain domain = domains.findById(entry.domainId());
        if (domain == null) {
            scheduleStore.set(entry.failed("domain_not_found"));
            return null;
        }
        boolean claimed = locks.withLock(entry.domainId(), () -> {
            ScheduledEntry current = scheduleStore.get(entryId);
            if (current == null || current.status() != ScheduledEntryStatus.SCHEDULED) {
                return false;
            }
            scheduleStore.set(current.withStatus(ScheduledEntryStatus.RUNNING));
            return true;
        });
        if (!claimed) {
            return null;
        }

        SubmittedTest submitted;
        try {
            submitted = submitTest(domain.ownerId(), domain.id(), providerKey);
        } catch (WarmupException e) {
            log.warn("Scheduled test {} for domain {} was rejected: {}", entryId, domain.name(), e.kind().code());
            locks.withLock(entry.domainId(), () -> {
                ScheduledEntry current = scheduleStore.get(entryId);
                if (current != null && current.status() == ScheduledEntryStatus.RUNNING) {
                    scheduleStore.set(current.failed(truncate(e.kind().code() + ": " + e.getMessage())));
                }
                return null;
            });
            return null;
        }

        PlacementTest test = submitted.test();
        return locks.withLock(entry.domainId(), () -> {
            ScheduledEntry current = scheduleStore.get(entryId);
            if (current == null || current.status() == ScheduledEntryStatus.CANCELLED) {
                // Cancelled while the provider call was in flight; stop polling this test.
                cancelPlacementTest(test.id());
                return tests.findById(test.id());
            }
            scheduleStore.set(current.running(test.id()));
            return test;
        });
    }

    /**
     * Moves a running entry to its terminal state once its placement test is done.
     *
     * @return the test status observed, or null when the entry is not running
     */
    PlacementTestStatus reconcileRunningEntry(ScheduledEntry entry) {
        if (entry.status() != ScheduledEntryStatus.RUNNING || entry.placementTestId() == null) {
            return null;
        }
        PlacementTest test = tests.findById(entry.placementTestId());
        if (test == null) {
            scheduleStore.set(entry.failed("placement_test_missing"));
            return null;
        }
        if (!test.status().isTerminal()) {
            return test.status();
        }
        locks.withLock(entry.domainId(), () -> {
            ScheduledEntry current = scheduleStore.get(entry.id());
            if (current == null || current.status() != ScheduledEntryStatus.RUNNING) {
                return null;
            }
            if (test.status() == PlacementTestStatus.COMPLETED) {
                scheduleStore.set(current.withStatus(ScheduledEntryStatus.COMPLETED));
            } else {
                scheduleStore.set(current.failed("placement_test_" + test.status().name().toLowerCase(Locale.ROOT)));
            }
            return null;
        });
        return test.status();
    }

    private void cancelPlacementTest(String testId) {
        PlacementTest test = tests.findById(testId);
        if (test != null && !test.status().isTerminal()) {
            tests.save(test.withStatus(PlacementTestStatus.CANCELLED, now()));
            log.info("Stopped polling placement test {}", testId);
        }
    }

    private void checkTestable(Domain domain, Instant now) {
        if (domain.status() == DomainStatus.INACTIVE) {
            throw new ValidationException("Domain " + domain.name() + " is inactive and is not tested");
        }
        if (domain.lastTestAt() != null) {
            Instant earliest = domain.lastTestAt().plus(policy.minimumSpacing());
            if (now.isBefore(earliest)) {
                throw new RateLimitExceededException(
                    "Domain " + domain.name() + " was tested less than "
                        + properties.getPolicy().getMinHoursBetweenTests() + "h ago",
                    Duration.between(now, earliest)
                );
            }
        }
        int quota = policy.monthlyTestQuota();
        int used = tests.countCreatedSince(domain.ownerId(), startOfMonth(now));
        if (used >= quota) {
            throw new QuotaExceededException(quota);
        }
    }

    private static Instant startOfMonth(Instant now) {
        return now.atZone(ZoneOffset.UTC)
            .withDayOfMonth(1)
            .truncatedTo(ChronoUnit.DAYS)
            .toInstant();
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
