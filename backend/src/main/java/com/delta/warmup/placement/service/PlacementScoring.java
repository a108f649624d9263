package com.delta.warmup.placement.service;

import com.delta.warmup.placement.model.DeliveryStatus;
import com.delta.warmup.placement.model.Placements;
import com.delta.warmup.placement.model.TestEmailOutcome;
import com.delta.warmup.placement.model.TestSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class PlacementScoring {
    static final String HIGH_SPAM_RATE =
        "High spam placement rate detected. Review email content and sending patterns.";
    static final String LOW_INBOX_RATE =
        "Low inbox placement rate. Verify SPF, DKIM, and DMARC records.";
    static final String DELIVERY_FAILURES =
        "Significant delivery failures detected. Check domain reputation.";

    private static final double SPAM_WARNING_PCT = 10.0;
    private static final double INBOX_TARGET_PCT = 80.0;
    private static final double OTHER_WARNING_PCT = 5.0;
    private static final Set<String> SPAM_FOLDERS = Set.of("spam", "junk", "junk email", "bulk");

    enum Placement {
        INBOX,
        SPAM,
        OTHER
    }

    private PlacementScoring() {
    }

    public static TestSummary summarize(Double overallScore, List<TestEmailOutcome> outcomes, Instant timestamp) {
        Placements placements = placements(outcomes);
        return new TestSummary(score(overallScore), placements, recommendations(placements), timestamp);
    }

    public static Placements placements(List<TestEmailOutcome> outcomes) {
        if (outcomes == null || outcomes.isEmpty()) {
            return Placements.empty();
        }
        int inbox = 0;
        int spam = 0;
        int other = 0;
        for (TestEmailOutcome outcome : outcomes) {
            switch (classify(outcome)) {
                case INBOX -> inbox++;
                case SPAM -> spam++;
                default -> other++;
            }
        }
        int total = outcomes.size();
        return new Placements(percent(inbox, total), percent(spam, total), percent(other, total));
    }

    public static int score(Double overallScore) {
        if (overallScore == null || overallScore.isNaN()) {
            return 0;
        }
        long rounded = Math.round(overallScore);
        return (int) Math.max(0, Math.min(100, rounded));
    }

    public static List<String> recommendations(Placements placements) {
        List<String> recommendations = new ArrayList<>();
        if (placements.spamPct() >= SPAM_WARNING_PCT) {
            recommendations.add(HIGH_SPAM_RATE);
        }
        if (placements.inboxPct() < INBOX_TARGET_PCT) {
            recommendations.add(LOW_INBOX_RATE);
        }
        if (placements.otherPct() >= OTHER_WARNING_PCT) {
            recommendations.add(DELIVERY_FAILURES);
        }
        return recommendations;
    }

    /**
     * Delivered mail lands in the inbox or the spam folder depending on the folder the seed mailbox reports.
     * Delivered mail with no recognised folder and undelivered mail both count as other.
     */
    static Placement classify(TestEmailOutcome outcome) {
        if (outcome.deliveryStatus() == DeliveryStatus.SPAM) {
            return Placement.SPAM;
        }
        if (outcome.deliveryStatus() != DeliveryStatus.DELIVERED || outcome.folder() == null) {
            return Placement.OTHER;
        }
        String folder = outcome.folder().trim().toLowerCase(Locale.ROOT);
        if (folder.equals("inbox")) {
            return Placement.INBOX;
        }
        if (SPAM_FOLDERS.contains(folder)) {
            return Placement.SPAM;
        }
        return Placement.OTHER;
    }

    private static double percent(int count, int total) {
        if (total == 0) {
            return 0.0;
        }
        return Math.round(count * 10000.0 / total) / 100.0;
    }
}
