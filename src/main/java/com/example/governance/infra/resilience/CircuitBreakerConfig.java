package com.example.governance.infra.resilience;

import java.time.Duration;

/**
 * Effective per-breaker policy, resolved once per name.
 *
 * @param errorThresholdPercentage base failure percentage that trips the breaker (before adaptation)
 * @param recoveryTimeout          how long the breaker stays OPEN before a probe is allowed
 * @param rollingWindow            age bound of the samples used for the failure percentage
 * @param minimumThroughput        the breaker never trips with fewer window samples than this
 * @param maxWindowSamples         count bound of the rolling window
 * @param halfOpenProbeWindow      number of most recent samples inspected while HALF_OPEN
 * @param halfOpenSuccessThreshold successes within the probe window needed to close
 */
public record CircuitBreakerConfig(double errorThresholdPercentage,
                                   Duration recoveryTimeout,
                                   Duration rollingWindow,
                                   int minimumThroughput,
                                   int maxWindowSamples,
                                   int halfOpenProbeWindow,
                                   int halfOpenSuccessThreshold) {

    public CircuitBreakerConfig {
        if (errorThresholdPercentage <= 0 || errorThresholdPercentage > 100) {
            throw new IllegalArgumentException("errorThresholdPercentage must be in (0, 100]: " + errorThresholdPercentage);
        }
        recoveryTimeout = recoveryTimeout == null ? Duration.ofSeconds(60) : recoveryTimeout;
        rollingWindow = rollingWindow == null ? Duration.ofSeconds(60) : rollingWindow;
        minimumThroughput = Math.max(1, minimumThroughput);
        maxWindowSamples = Math.max(minimumThroughput, maxWindowSamples);
        halfOpenProbeWindow = Math.max(1, halfOpenProbeWindow);
        halfOpenSuccessThreshold = Math.max(1, Math.min(halfOpenSuccessThreshold, halfOpenProbeWindow));
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(50d, Duration.ofSeconds(60), Duration.ofSeconds(60), 10, 1000, 5, 3);
    }

    public CircuitBreakerConfig withRecoveryTimeout(Duration timeout) {
        return new CircuitBreakerConfig(errorThresholdPercentage, timeout, rollingWindow, minimumThroughput,
                maxWindowSamples, halfOpenProbeWindow, halfOpenSuccessThreshold);
    }

    public CircuitBreakerConfig withMinimumThroughput(int value) {
        return new CircuitBreakerConfig(errorThresholdPercentage, recoveryTimeout, rollingWindow, value,
                maxWindowSamples, halfOpenProbeWindow, halfOpenSuccessThreshold);
    }
}
