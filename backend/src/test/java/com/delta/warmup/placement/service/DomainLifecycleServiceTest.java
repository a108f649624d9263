package com.delta.warmup.placement.service;

import com.delta.warmup.placement.error.InvalidTransitionException;
import com.delta.warmup.placement.error.NotFoundException;
import com.delta.warmup.placement.error.ValidationException;
import com.delta.warmup.placement.model.Domain;
import com.delta.warmup.placement.model.DomainStatus;
import com.delta.warmup.placement.model.HealthStatus;
import com.delta.warmup.placement.model.LifecycleSignals;
import com.delta.warmup.placement.model.Placements;
import com.delta.warmup.placement.model.ProviderType;
import com.delta.warmup.placement.model.TestSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DomainLifecycleServiceTest {
    private final PlacementFixture fixture = new PlacementFixture();
    private final DomainLifecycleService lifecycle = fixture.lifecycle;

    @Test
    void registerStartsWarmingAtTheWarmingCapAndIsDueImmediately() {
        Domain domain = lifecycle.register(PlacementFixture.OWNER, "Mail.Example.com", 10_000, null);

        assertThat(domain.status()).isEqualTo(DomainStatus.WARMING);
        assertThat(domain.name()).isEqualTo("mail.example.com");
        assertThat(domain.dailySendVolume()).isEqualTo(2500);
        assertThat(domain.nextTestAt()).isEqualTo(fixture.clock.instant());
        assertThat(domain.lastTestAt()).isNull();
    }

    @Test
    void registerClampsRequestedVolumeAndRejectsBadInput() {
        Domain domain = lifecycle.register(PlacementFixture.OWNER, "example.com", 1000, 900);
        assertThat(domain.dailySendVolume()).isEqualTo(250);

        assertThatThrownBy(() -> lifecycle.register(PlacementFixture.OWNER, "example.com", 1000, null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> lifecycle.register(PlacementFixture.OWNER, "not a domain", 1000, null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> lifecycle.register(PlacementFixture.OWNER, "other.com", -1, null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> lifecycle.register(" ", "other.com", 10, null))
            .isInstanceOf(ValidationException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "WARMING, ACTIVE, true",
        "ACTIVE, INACTIVE, true",
        "WARMING, INACTIVE, false",
        "WARMING, WARMING, false",
        "ACTIVE, WARMING, false",
        "ACTIVE, ACTIVE, false",
        "INACTIVE, ACTIVE, false",
        "INACTIVE, WARMING, false",
        "INACTIVE, INACTIVE, false"
    })
    void onlyForwardTransitionsAreAllowed(DomainStatus from, DomainStatus to, boolean allowed) {
        Domain domain = fixture.insertDomain("example.com", from, 0, 1000, List.of());

        if (allowed) {
            assertThat(lifecycle.transition(PlacementFixture.OWNER, domain.id(), to).status()).isEqualTo(to);
        } else {
            assertThatThrownBy(() -> lifecycle.transition(PlacementFixture.OWNER, domain.id(), to))
                .isInstanceOf(InvalidTransitionException.class);
            assertThat(fixture.domains.findById(domain.id())).isEqualTo(domain);
        }
    }

    @Test
    void transitionRecomputesCadenceAndVolume() {
        Domain warming = fixture.insertDomain("example.com", DomainStatus.WARMING, 2500, 10_000, List.of());
        Instant lastTest = fixture.clock.instant().minus(Duration.ofHours(5));
        fixture.domains.compareAndSetTestTimes(warming.id(), null, lastTest, lastTest.plus(Duration.ofHours(24)));

        Domain active = lifecycle.transition(PlacementFixture.OWNER, warming.id(), DomainStatus.ACTIVE);
        assertThat(active.nextTestAt()).isEqualTo(lastTest.plus(Duration.ofHours(72)));
        assertThat(active.dailySendVolume()).isEqualTo(2500);
        assertThat(lifecycle.volumeCap(active)).isEqualTo(10_000);

        Domain inactive = lifecycle.transition(PlacementFixture.OWNER, warming.id(), DomainStatus.INACTIVE);
        assertThat(inactive.nextTestAt()).isNull();
        assertThat(inactive.dailySendVolume()).isZero();
        assertThat(inactive.lastTestAt()).isEqualTo(lastTest);
    }

    @Test
    void resetToWarmingIsSeparateFromValidatedTransitions() {
        Domain domain = fixture.insertDomain("example.com", DomainStatus.INACTIVE, 0, 4000, List.of());

        Domain reset = lifecycle.resetToWarming(PlacementFixture.OWNER, domain.id());

        assertThat(reset.status()).isEqualTo(DomainStatus.WARMING);
        assertThat(reset.dailySendVolume()).isEqualTo(1000);
        assertThat(reset.nextTestAt()).isEqualTo(fixture.clock.instant().plus(Duration.ofHours(24)));
        assertThatThrownBy(() -> lifecycle.resetToWarming(PlacementFixture.OWNER, domain.id()))
            .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void domainsAreScopedToTheirOwner() {
        Domain domain = fixture.insertDomain("example.com", DomainStatus.WARMING, 0, 1000, List.of());

        assertThatThrownBy(() -> lifecycle.getDomain("someone-else", domain.id()))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> lifecycle.transition("someone-else", domain.id(), DomainStatus.ACTIVE))
            .isInstanceOf(NotFoundException.class);
        assertThat(lifecycle.listDomains("someone-else")).isEmpty();
        assertThat(lifecycle.listDomains(PlacementFixture.OWNER)).containsExactly(domain);
    }

    @Test
    void graduationSignalIsAppliedThroughTheTransition() {
        Instant t = fixture.clock.instant();
        Domain domain = fixture.insertDomain("example.com", DomainStatus.WARMING, 2500, 10_000, List.of(
            fixture.history(80, t.minus(Duration.ofDays(3))),
            fixture.history(72, t.minus(Duration.ofDays(2))),
            fixture.history(78, t.minus(Duration.ofDays(1)))
        ));

        LifecycleSignals signals = lifecycle.evaluate(PlacementFixture.OWNER, domain.id());
        assertThat(signals.shouldGraduate()).isTrue();
        assertThat(signals.rotationEligible()).isTrue();
        assertThat(signals.healthScore()).isEqualTo(77);
        assertThat(signals.health()).isEqualTo(HealthStatus.WARNING);
        assertThat(signals.volumeCap()).isEqualTo(2500);

        Domain applied = lifecycle.applySignals(PlacementFixture.OWNER, domain.id());
        assertThat(applied.status()).isEqualTo(DomainStatus.ACTIVE);
    }

    @Test
    void twoLowScoresDeactivateAnActiveDomain() {
        Instant t = fixture.clock.instant();
        Domain domain = fixture.insertDomain("example.com", DomainStatus.ACTIVE, 5000, 10_000, List.of(
            fixture.history(88, t.minus(Duration.ofDays(6))),
            fixture.history(65, t.minus(Duration.ofDays(3))),
            fixture.history(52, t)
        ));

        LifecycleSignals signals = lifecycle.evaluate(PlacementFixture.OWNER, domain.id());
        assertThat(signals.shouldDeactivate()).isTrue();
        assertThat(signals.rotationEligible()).isFalse();

        Domain applied = lifecycle.applySignals(PlacementFixture.OWNER, domain.id());
        assertThat(applied.status()).isEqualTo(DomainStatus.INACTIVE);
        assertThat(applied.dailySendVolume()).isZero();
        assertThat(applied.nextTestAt()).isNull();
    }

    @Test
    void singleLowScoreDoesNotDeactivate() {
        Instant t = fixture.clock.instant();
        Domain domain = fixture.insertDomain("example.com", DomainStatus.ACTIVE, 5000, 10_000, List.of(
            fixture.history(75, t.minus(Duration.ofDays(3))),
            fixture.history(60, t)
        ));

        assertThat(lifecycle.evaluate(PlacementFixture.OWNER, domain.id()).shouldDeactivate()).isFalse();
    }

    @Test
    void highScoreStreakIncreasesVolumeOncePerStreak() {
        Instant t = fixture.clock.instant();
        Domain domain = fixture.insertDomain("example.com", DomainStatus.ACTIVE, 1000, 10_000, List.of(
            fixture.history(95, t.minus(Duration.ofDays(9))),
            fixture.history(92, t.minus(Duration.ofDays(6))),
            fixture.history(97, t.minus(Duration.ofDays(3)))
        ));

        LifecycleSignals signals = lifecycle.evaluate(PlacementFixture.OWNER, domain.id());
        assertThat(signals.shouldIncreaseVolume()).isTrue();
        assertThat(signals.recommendedVolume()).isEqualTo(1250);

        Domain applied = lifecycle.applySignals(PlacementFixture.OWNER, domain.id());
        assertThat(applied.dailySendVolume()).isEqualTo(1250);
        assertThat(applied.volumeAdjustedAt()).isEqualTo(t);

        assertThat(lifecycle.evaluate(PlacementFixture.OWNER, domain.id()).shouldIncreaseVolume()).isFalse();
        assertThat(lifecycle.applySignals(PlacementFixture.OWNER, domain.id()).dailySendVolume()).isEqualTo(1250);
    }

    @Test
    void volumeIncreaseNeverExceedsTheStatusCap() {
        Instant t = fixture.clock.instant();
        Domain domain = fixture.insertDomain("example.com", DomainStatus.WARMING, 2400, 10_000, List.of(
            fixture.history(91, t.minus(Duration.ofDays(3))),
            fixture.history(93, t.minus(Duration.ofDays(2))),
            fixture.history(92, t.minus(Duration.ofDays(1)))
        ));
        fixture.properties.getPolicy().setGraduationAverageScore(100);

        LifecycleSignals signals = lifecycle.evaluate(PlacementFixture.OWNER, domain.id());

        assertThat(signals.shouldGraduate()).isFalse();
        assertThat(signals.recommendedVolume()).isEqualTo(2500);
    }

    @Test
    void recordSummaryAppendsOnceAndTrimsHistory() {
        Domain domain = fixture.insertDomain("example.com", DomainStatus.WARMING, 0, 1000, List.of());
        for (int i = 0; i < 12; i++) {
            TestSummary summary = new TestSummary(50 + i, Placements.empty(), List.of(), fixture.clock.instant());
            lifecycle.recordSummary(domain.id(), "test-" + i, ProviderType.EMAILGUARD, summary);
            fixture.clock.advance(Duration.ofHours(24));
        }
        TestSummary duplicate = new TestSummary(1, Placements.empty(), List.of(), fixture.clock.instant());
        lifecycle.recordSummary(domain.id(), "test-11", ProviderType.EMAILGUARD, duplicate);

        Domain stored = fixture.domains.findById(domain.id());
        assertThat(stored.testHistory()).hasSize(10);
        assertThat(stored.testHistory().get(0).testId()).isEqualTo("test-2");
        assertThat(stored.latestTest().score()).isEqualTo(61);
    }

    @Test
    void emptyHistoryHasNoSignals() {
        Domain domain = fixture.insertDomain("example.com", DomainStatus.WARMING, 0, 1000, List.of());

        LifecycleSignals signals = lifecycle.evaluate(PlacementFixture.OWNER, domain.id());

        assertThat(signals.latestScore()).isNull();
        assertThat(signals.rotationEligible()).isFalse();
        assertThat(signals.shouldGraduate()).isFalse();
        assertThat(signals.shouldIncreaseVolume()).isFalse();
        assertThat(signals.health()).isEqualTo(HealthStatus.WARNING);
    }
}
