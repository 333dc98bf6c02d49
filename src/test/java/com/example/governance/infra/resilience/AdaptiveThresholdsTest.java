package com.example.governance.infra.resilience;

import com.example.governance.error.ErrorType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class AdaptiveThresholdsTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void mostlyTransientFailuresRelaxThreshold() {
        AdaptiveThresholds t = new AdaptiveThresholds(50d, new CircuitBreakerProperties.Adaptive(), T0);

        t.update(samples(12, 8, ErrorType.TIMEOUT_ERROR), T0);

        assertThat(t.failureThreshold()).isEqualTo(75d);
    }

    @Test
    void relaxedThresholdIsCapped() {
        AdaptiveThresholds t = new AdaptiveThresholds(60d, new CircuitBreakerProperties.Adaptive(), T0);

        t.update(samples(10, 10, ErrorType.NETWORK_ERROR), T0);

        assertThat(t.failureThreshold()).isEqualTo(80d);
    }

    @Test
    void persistentFailuresTightenThresholdDownToFloor() {
        AdaptiveThresholds t = new AdaptiveThresholds(50d, new CircuitBreakerProperties.Adaptive(), T0);
        t.update(samples(10, 10, ErrorType.DATABASE_ERROR), T0);
        assertThat(t.failureThreshold()).isEqualTo(40d);

        AdaptiveThresholds low = new AdaptiveThresholds(20d, new CircuitBreakerProperties.Adaptive(), T0);
        low.update(samples(10, 10, ErrorType.DATABASE_ERROR), T0);
        assertThat(low.failureThreshold()).isEqualTo(20d);
    }

    @Test
    void noAdaptationBelowMinimumSamples() {
        AdaptiveThresholds t = new AdaptiveThresholds(50d, new CircuitBreakerProperties.Adaptive(), T0);

        t.update(samples(10, 9, ErrorType.TIMEOUT_ERROR), T0);

        assertThat(t.failureThreshold()).isEqualTo(50d);
    }

    @Test
    void responseTimeThresholdTracksP95() {
        AdaptiveThresholds t = new AdaptiveThresholds(50d, new CircuitBreakerProperties.Adaptive(), T0);
        List<CircuitBreakerMetric> recent = new ArrayList<>();
        for (int i = 1; i <= 20; i++) {
            CircuitBreakerMetric m = CircuitBreakerMetric.success(T0.plusMillis(i), i * 100L);
            t.record(m);
            recent.add(m);
        }

        t.update(recent, T0);

        assertThat(t.responseTimeThresholdMs()).isEqualTo(2000L);
    }

    private static List<CircuitBreakerMetric> samples(int successes, int failures, ErrorType type) {
        List<CircuitBreakerMetric> out = new ArrayList<>();
        for (int i = 0; i < successes; i++) {
            out.add(CircuitBreakerMetric.success(T0, 10L));
        }
        for (int i = 0; i < failures; i++) {
            out.add(CircuitBreakerMetric.failure(T0, 10L, type));
        }
        return out;
    }
}
