package com.delta.warmup.placement.service;

import com.delta.warmup.config.WarmupProperties;
import com.delta.warmup.placement.model.Domain;
import com.delta.warmup.placement.model.DomainStatus;
import com.delta.warmup.placement.model.HealthStatus;
import com.delta.warmup.placement.model.LifecycleSignals;
import com.delta.warmup.placement.model.TestHistoryEntry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Pure rules over a domain's status and score history. Nothing here mutates state.
 */
@Component
public class LifecyclePolicy {
    private static final int HEALTH_WINDOW = 3;
    private static final int HEALTHY_SCORE = 80;
    private static final int WARNING_SCORE = 50;

    private final WarmupProperties.Policy policy;

    public LifecyclePolicy(WarmupProperties properties) {
        this.policy = properties.getPolicy();
    }

    public boolean isAllowed(DomainStatus from, DomainStatus to) {
        return (from == DomainStatus.WARMING && to == DomainStatus.ACTIVE)
            || (from == DomainStatus.ACTIVE && to == DomainStatus.INACTIVE);
    }

    public Duration cadence(DomainStatus status) {
        return switch (status) {
            case WARMING -> Duration.ofHours(policy.getWarmingCadenceHours());
            case ACTIVE -> Duration.ofHours(policy.getActiveCadenceHours());
            case INACTIVE -> null;
        };
    }

    public Instant nextTestAt(DomainStatus status, Instant from) {
        Duration cadence = cadence(status);
        return cadence == null || from == null ? null : from.plus(cadence);
    }

    public int volumeCap(DomainStatus status, int maxSendVolume) {
        return switch (status) {
            case WARMING -> (int) ((long) maxSendVolume * policy.getWarmingVolumePercent() / 100);
            case ACTIVE -> maxSendVolume;
            case INACTIVE -> 0;
        };
    }

    public int volumeCap(Domain domain) {
        return volumeCap(domain.status(), domain.maxSendVolume());
    }

    public Duration minimumSpacing() {
        return Duration.ofHours(policy.getMinHoursBetweenTests());
    }

    public int historyLimit() {
        return policy.getHistoryLimit();
    }

    public int monthlyTestQuota() {
        return policy.getMonthlyTestQuota();
    }

    public LifecycleSignals evaluate(Domain domain) {
        List<TestHistoryEntry> history = domain.testHistory();
        TestHistoryEntry latest = domain.latestTest();
        Integer latestScore = latest == null ? null : latest.score();
        int cap = volumeCap(domain);

        boolean rotationEligible = latestScore != null && latestScore >= policy.getRotationScoreThreshold();

        List<TestHistoryEntry> lowWindow = tail(history, policy.getLowScoreStreak());
        boolean shouldDeactivate = domain.status() == DomainStatus.ACTIVE
            && lowWindow.size() == policy.getLowScoreStreak()
            && lowWindow.stream().allMatch(entry -> entry.score() < policy.getRotationScoreThreshold());

        List<TestHistoryEntry> graduationWindow = tail(history, policy.getGraduationWindow());
        boolean shouldGraduate = domain.status() == DomainStatus.WARMING
            && graduationWindow.size() == policy.getGraduationWindow()
            && average(graduationWindow) >= policy.getGraduationAverageScore();

        int recommendedVolume = increasedVolume(domain.dailySendVolume(), cap);
        List<TestHistoryEntry> highWindow = tail(history, policy.getHighScoreStreak());
        boolean shouldIncreaseVolume = domain.status() != DomainStatus.INACTIVE
            && highWindow.size() == policy.getHighScoreStreak()
            && highWindow.stream().allMatch(entry -> entry.score() > policy.getHighScoreThreshold())
            && isAfterLastAdjustment(highWindow.get(highWindow.size() - 1), domain.volumeAdjustedAt())
            && recommendedVolume > domain.dailySendVolume();

        List<TestHistoryEntry> healthWindow = tail(history, HEALTH_WINDOW);
        int healthScore = healthWindow.isEmpty() ? 0 : (int) Math.round(average(healthWindow));
        HealthStatus health;
        if (healthWindow.isEmpty()) {
            health = HealthStatus.WARNING;
        } else if (healthScore >= HEALTHY_SCORE) {
            health = HealthStatus.HEALTHY;
        } else if (healthScore >= WARNING_SCORE) {
            health = HealthStatus.WARNING;
        } else {
            health = HealthStatus.CRITICAL;
        }

        return new LifecycleSignals(
            domain.id(),
            domain.status(),
            latestScore,
            healthScore,
            health,
            rotationEligible,
            shouldGraduate,
            shouldDeactivate,
            shouldIncreaseVolume,
            shouldIncreaseVolume ? recommendedVolume : domain.dailySendVolume(),
            cap
        );
    }

    int increasedVolume(int current, int cap) {
        int step = (int) ((long) current * policy.getVolumeIncreasePercent() / 100);
        if (policy.getVolumeIncreasePercent() > 0) {
            step = Math.max(1, step);
        }
        return Math.min(cap, current + step);
    }

    private static boolean isAfterLastAdjustment(TestHistoryEntry newest, Instant volumeAdjustedAt) {
        return volumeAdjustedAt == null || (newest.timestamp() != null && newest.timestamp().isAfter(volumeAdjustedAt));
    }

    private static List<TestHistoryEntry> tail(List<TestHistoryEntry> history, int size) {
        if (history.size() <= size) {
            return history;
        }
        return history.subList(history.size() - size, history.size());
    }

    private static double average(List<TestHistoryEntry> entries) {
        return entries.stream().mapToInt(TestHistoryEntry::score).average().orElse(0.0);
    }
}
