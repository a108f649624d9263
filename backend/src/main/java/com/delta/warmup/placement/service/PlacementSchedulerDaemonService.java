package com.delta.warmup.placement.service;

import com.delta.warmup.config.WarmupProperties;
import com.delta.warmup.placement.error.WarmupException;
import com.delta.warmup.placement.model.Domain;
import com.delta.warmup.placement.model.PlacementTest;
import com.delta.warmup.placement.model.PlacementTestStatus;
import com.delta.warmup.placement.model.ScheduledEntry;
import com.delta.warmup.placement.model.ScheduledEntryStatus;
import com.delta.warmup.placement.model.SchedulerCycleSummary;
import com.delta.warmup.placement.model.SchedulerDaemonStatusResponse;
import com.delta.warmup.placement.persistence.DomainRepository;
import com.delta.warmup.placement.persistence.PlacementTestRepository;
import com.delta.warmup.placement.persistence.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class PlacementSchedulerDaemonService {
    private static final Logger log = LoggerFactory.getLogger(PlacementSchedulerDaemonService.class);
    private static final Set<PlacementTestStatus> IN_FLIGHT =
        EnumSet.of(PlacementTestStatus.CREATED, PlacementTestStatus.IN_PROGRESS);

    private final DomainRepository domains;
    private final PlacementTestRepository tests;
    private final ScheduleStore scheduleStore;
    private final TestOrchestratorService orchestrator;
    private final DomainLifecycleService lifecycle;
    private final WarmupProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong cyclesCompleted = new AtomicLong();
    private final Object lifecycleLock = new Object();

    private volatile Instant lastCycleAt;
    private ExecutorService executor;

    public PlacementSchedulerDaemonService(
        DomainRepository domains,
        PlacementTestRepository tests,
        ScheduleStore scheduleStore,
        TestOrchestratorService orchestrator,
        DomainLifecycleService lifecycle,
        WarmupProperties properties,
        Clock clock
    ) {
        this.domains = domains;
        this.tests = tests;
        this.scheduleStore = scheduleStore;
        this.orchestrator = orchestrator;
        this.lifecycle = lifecycle;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getDaemon().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public SchedulerDaemonStatusResponse getStatus() {
        int scheduled = 0;
        int inProgress = 0;
        try {
            scheduled = scheduleStore.listByStatus(ScheduledEntryStatus.SCHEDULED).size();
            inProgress = scheduleStore.listByStatus(ScheduledEntryStatus.RUNNING).size();
        } catch (Exception e) {
            log.warn("Failed to load schedule stats", e);
        }
        return new SchedulerDaemonStatusResponse(running.get(), cyclesCompleted.get(), lastCycleAt, scheduled, inProgress);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int pollIntervalMs = properties.getDaemon().getPollIntervalMs();
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("placement-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.submit(() -> workerLoop(pollIntervalMs));
            log.info("Placement scheduler started (poll interval {}ms)", pollIntervalMs);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Placement scheduler stopped");
        }
    }

    /**
     * One pass: queue due domains, start due entries, poll in-flight tests, settle finished entries.
     */
    public SchedulerCycleSummary runCycle() {
        Instant now = clock.instant();
        int batchSize = properties.getDaemon().getBatchSize();
        String providerKey = properties.getDaemon().getDefaultProvider();

        int scheduled = scheduleDueDomains(now, batchSize);

        int submitted = 0;
        int failed = 0;
        List<ScheduledEntry> due = scheduleStore.listByStatus(ScheduledEntryStatus.SCHEDULED).stream()
            .filter(entry -> !entry.scheduledFor().isAfter(now))
            .limit(batchSize)
            .toList();
        for (ScheduledEntry entry : due) {
            try {
                PlacementTest test = orchestrator.runScheduledEntry(entry.id(), providerKey);
                if (test != null) {
                    submitted++;
                } else {
                    failed++;
                }
            } catch (Exception e) {
                failed++;
                log.warn("Scheduler failed to start entry {}", entry.id(), e);
            }
        }

        for (PlacementTest test : tests.findByStatuses(IN_FLIGHT, batchSize)) {
            try {
                orchestrator.pollResults(test.id());
            } catch (WarmupException e) {
                log.warn("Polling placement test {} failed: {}", test.id(), e.kind().code());
            } catch (Exception e) {
                log.warn("Polling placement test {} failed", test.id(), e);
            }
        }

        int completed = 0;
        int pending = 0;
        for (ScheduledEntry entry : scheduleStore.listByStatus(ScheduledEntryStatus.RUNNING)) {
            try {
                PlacementTestStatus status = orchestrator.reconcileRunningEntry(entry);
                if (status == PlacementTestStatus.COMPLETED) {
                    completed++;
                    applySignalsIfEnabled(entry.domainId());
                } else if (status != null && !status.isTerminal()) {
                    pending++;
                }
            } catch (Exception e) {
                log.warn("Scheduler failed to settle entry {}", entry.id(), e);
            }
        }

        lastCycleAt = now;
        cyclesCompleted.incrementAndGet();
        return new SchedulerCycleSummary(scheduled, submitted, failed, completed, pending);
    }

    private int scheduleDueDomains(Instant now, int batchSize) {
        Set<String> busy = new HashSet<>();
        scheduleStore.listByStatus(ScheduledEntryStatus.SCHEDULED).forEach(entry -> busy.add(entry.domainId()));
        scheduleStore.listByStatus(ScheduledEntryStatus.RUNNING).forEach(entry -> busy.add(entry.domainId()));
        int scheduled = 0;
        for (Domain domain : domains.findDueForTesting(now, batchSize)) {
            if (busy.contains(domain.id())) {
                continue;
            }
            orchestrator.enqueue(domain, now);
            scheduled++;
        }
        return scheduled;
    }

    private void applySignalsIfEnabled(String domainId) {
        if (!properties.getDaemon().isAutoApplySignals()) {
            return;
        }
        Domain domain = domains.findById(domainId);
        if (domain == null) {
            return;
        }
        try {
            lifecycle.applySignals(domain.ownerId(), domainId);
        } catch (WarmupException e) {
            log.warn("Applying lifecycle signals for {} failed: {}", domain.name(), e.kind().code());
        }
    }

    private void workerLoop(int pollIntervalMs) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                SchedulerCycleSummary summary = runCycle();
                if (summary.testsSubmitted() > 0 || summary.testsCompleted() > 0) {
                    log.info(
                        "Scheduler cycle: {} queued, {} submitted, {} rejected, {} completed",
                        summary.entriesScheduled(),
                        summary.testsSubmitted(),
                        summary.submissionsFailed(),
                        summary.testsCompleted()
                    );
                }
            } catch (Exception e) {
                log.warn("Scheduler cycle failed", e);
            }
            sleep(pollIntervalMs);
        }
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(100, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
