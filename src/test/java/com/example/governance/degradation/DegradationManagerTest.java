package com.example.governance.degradation;

import com.example.governance.MutableClock;
import com.example.governance.observability.ReliabilityEvent;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.store.InMemoryReliabilityStore;
import com.example.governance.store.ReliabilityStore;
import com.example.governance.store.ReliabilityStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

public class DegradationManagerTest {

    private MutableClock clock;
    private SnapshotSystemMetricsSource metrics;
    private InMemoryReliabilityStore store;
    private ReliabilityEventPublisher events;
    private final List<ReliabilityEvent> seen = new ArrayList<>();
    private final List<String> activated = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        metrics = new SnapshotSystemMetricsSource();
        store = new InMemoryReliabilityStore();
        events = new ReliabilityEventPublisher(clock);
        events.subscribe(seen::add);
    }

    @Test
    void severeCpuAssessmentJumpsTwoLevels() {
        DegradationManager manager = manager(store, s -> activated.add(s.strategyId()));
        metrics.update(SystemHealthMetrics.of(0.01, 200, 97, 40));

        manager.performAutomaticAssessment();

        assertThat(manager.getCurrentLevel().level()).isEqualTo(2);
        assertThat(store.degradationEvents()).singleElement().satisfies(row -> {
            assertThat(row.eventType()).isEqualTo("escalated");
            assertThat(row.triggerData().metric()).isEqualTo(SystemHealthMetrics.CPU_USAGE);
            assertThat(row.triggerData().observedValue()).isEqualTo(97d);
        });
    }

    @Test
    void severeCpuFromLevelThreeIsCappedAtTop() {
        DegradationManager manager = manager(store, null);
        manager.escalateTo(3, "test");
        metrics.update(SystemHealthMetrics.of(0.01, 200, 97, 40));

        manager.performAutomaticAssessment();

        assertThat(manager.getCurrentLevel().level()).isEqualTo(4);
    }

    @Test
    void recoveryStepsDownOneLevelAtATime() {
        DegradationManager manager = manager(store, null);
        manager.escalateTo(3, "test");

        assertThat(manager.recoverDegradation()).isFalse();
        assertThat(manager.checkRecoveryConditions().reasons()).containsExactly("Insufficient stability period");

        for (int expected = 2; expected >= 0; expected--) {
            clock.advance(Duration.ofMinutes(5));
            assertThat(manager.recoverDegradation()).isTrue();
            assertThat(manager.getCurrentLevel().level()).isEqualTo(expected);
            assertThat(manager.recoverDegradation()).isFalse();
        }
        clock.advance(Duration.ofMinutes(5));
        assertThat(manager.recoverDegradation()).isFalse();
    }

    @Test
    void unhealthyMetricsBlockRecovery() {
        DegradationManager manager = manager(store, null);
        manager.escalateTo(1, "test");
        clock.advance(Duration.ofMinutes(10));
        metrics.update(SystemHealthMetrics.of(0.2, 6000, 50, 50));

        RecoveryCheck check = manager.checkRecoveryConditions();

        assertThat(check.allowed()).isFalse();
        assertThat(check.reasons()).containsExactly("Error rate too high", "Response time too high");
        assertThat(manager.recoverDegradation()).isFalse();
    }

    @Test
    void flappingLimitsEscalationToOneLevel() {
        DegradationManager manager = manager(store, null);
        for (int i = 0; i < 3; i++) {
            manager.escalateTo(1, "flap");
            clock.advance(Duration.ofMinutes(5));
            manager.recoverDegradation();
            clock.advance(Duration.ofMinutes(1));
        }
        assertThat(manager.getCurrentLevel().level()).isZero();

        boolean changed = manager.escalateDegradation(
                TriggerCondition.gt(SystemHealthMetrics.CPU_USAGE, 90, 30_000L).observed(97));

        assertThat(changed).isTrue();
        assertThat(manager.getCurrentLevel().level()).isEqualTo(1);
    }

    @Test
    void escalationAtOrBelowCurrentLevelIsNoOp() {
        DegradationManager manager = manager(store, null);
        manager.escalateTo(4, "test");

        assertThat(manager.escalateDegradation(TriggerCondition.gt(SystemHealthMetrics.CPU_USAGE, 90, 30_000L).observed(92)))
                .isFalse();
        assertThat(manager.escalateTo(2, "lower")).isFalse();
    }

    @Test
    void featureFlagsFollowLevel() {
        DegradationManager manager = manager(store, null);
        assertThat(manager.isFeatureEnabled(Features.ADVANCED_ANALYTICS)).isTrue();

        manager.escalateTo(2, "test");

        assertThat(manager.isFeatureEnabled(Features.ADVANCED_ANALYTICS)).isFalse();
        assertThat(manager.isFeatureEnabled(Features.REAL_TIME_PROCESSING)).isTrue();
        assertThat(manager.getFeatureStates().get(Features.BACKGROUND_JOBS).degradationLevel()).isEqualTo(2);
        assertThat(manager.isFeatureEnabled("not_managed")).isTrue();
    }

    @Test
    void triggeredLevelFallbacksAreActivated() {
        DegradationManager manager = manager(store, s -> activated.add(s.strategyId()));
        metrics.update(SystemHealthMetrics.of(0.01, 200, 85, 40));

        manager.escalateTo(1, "test");

        assertThat(activated).containsExactly("disable_background_jobs");
        assertThat(manager.getActiveFallbacks()).containsExactly("disable_background_jobs");
        assertThat(seen).extracting(ReliabilityEvent::type).contains("fallback_strategy_activated");
    }

    @Test
    void failingFallbackActivationIsSkipped() {
        DegradationManager manager = manager(store, s -> {
            throw new IllegalStateException("executor down");
        });
        metrics.update(SystemHealthMetrics.of(0.01, 200, 85, 40));

        assertThat(manager.escalateTo(1, "test")).isTrue();
        assertThat(manager.getActiveFallbacks()).isEmpty();
    }

    @Test
    void availableFallbacksIncludeGlobalOnesBestQualityFirst() {
        DegradationManager manager = manager(store, null);
        metrics.update(new SystemHealthMetrics(0.01, 200, 85, 40, 0, 0,
                Map.of("database_error_rate", 0.6, "downstream_error_rate", 0.4)));
        manager.escalateTo(1, "test");

        assertThat(manager.getAvailableFallbacks("any"))
                .extracting(FallbackStrategy::strategyId)
                .containsExactly("circuit_breaker_fallback", "disable_background_jobs", "cache_fallback");
    }

    @Test
    void storeFailureDoesNotBlockEscalation() {
        ReliabilityStore broken = Mockito.mock(ReliabilityStore.class);
        doThrow(new ReliabilityStoreException("disk full", null)).when(broken).appendDegradationEvent(any());
        DegradationManager manager = manager(broken, null);

        assertThat(manager.escalateTo(2, "test")).isTrue();
        assertThat(manager.getCurrentLevel().level()).isEqualTo(2);
    }

    private DegradationManager manager(ReliabilityStore s, FallbackActivator activator) {
        DegradationProperties props = new DegradationProperties();
        return new DegradationManager(DegradationLevelCatalog.defaults(), new AdaptiveDegradationController(props),
                new DegradationMetricsCollector(clock, props.getChangeHistoryRetention()), metrics, s, events, props,
                clock, activator);
    }
}
