package com.example.governance.infra.resilience;

import com.example.governance.error.ErrorType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Failure/response-time thresholds learned from the breaker's own history.
 *
 * <p>Not thread-safe; always accessed under the owning breaker's lock.</p>
 */
public class AdaptiveThresholds {

    private final double baseFailureThreshold;
    private final CircuitBreakerProperties.Adaptive policy;
    private final Deque<CircuitBreakerMetric> history = new ArrayDeque<>();

    private double failureThreshold;
    private long responseTimeThresholdMs;
    private Instant lastUpdated;

    public AdaptiveThresholds(double baseFailureThreshold, CircuitBreakerProperties.Adaptive policy, Instant now) {
        this.baseFailureThreshold = baseFailureThreshold;
        this.policy = policy == null ? new CircuitBreakerProperties.Adaptive() : policy;
        reset(now);
    }

    public void record(CircuitBreakerMetric sample) {
        history.addLast(sample);
        Instant cutoff = sample.timestamp().minus(retention());
        while (!history.isEmpty() && history.peekFirst().timestamp().isBefore(cutoff)) {
            history.removeFirst();
        }
    }

    /**
     * Re-tunes both thresholds from {@code recent}. No-op while fewer than the configured
     * minimum samples exist.
     */
    public void update(Collection<CircuitBreakerMetric> recent, Instant now) {
        if (!policy.isEnabled() || recent == null || recent.size() < policy.getMinSamples()) {
            return;
        }
        int failures = 0;
        int transientFailures = 0;
        for (CircuitBreakerMetric m : recent) {
            if (m.success()) {
                continue;
            }
            failures++;
            ErrorType t = m.errorType();
            if (t != null && t.isTransient()) {
                transientFailures++;
            }
        }
        double transientRatio = failures == 0 ? 0d : (double) transientFailures / failures;
        if (transientRatio > policy.getLenientRatio()) {
            failureThreshold = Math.min(baseFailureThreshold * policy.getLenientMultiplier(), policy.getLenientCap());
        } else if (transientRatio < policy.getStrictRatio()) {
            failureThreshold = Math.max(baseFailureThreshold * policy.getStrictMultiplier(), policy.getStrictFloor());
        }
        adjustResponseTimeThreshold();
        lastUpdated = now;
    }

    private void adjustResponseTimeThreshold() {
        int sampleSize = Math.max(1, policy.getResponseTimeSampleSize());
        List<Long> times = new ArrayList<>(sampleSize);
        Iterator<CircuitBreakerMetric> it = history.descendingIterator();
        while (it.hasNext() && times.size() < sampleSize) {
            times.add(it.next().responseTimeMs());
        }
        if (times.size() < policy.getMinSamples()) {
            return;
        }
        times.sort(null);
        int p95Index = (int) Math.floor(times.size() * 0.95d);
        responseTimeThresholdMs = times.get(Math.min(p95Index, times.size() - 1));
    }

    public void reset(Instant now) {
        failureThreshold = baseFailureThreshold;
        responseTimeThresholdMs = policy.getDefaultResponseTimeThresholdMs();
        lastUpdated = now;
        history.clear();
    }

    public double failureThreshold() {
        return failureThreshold;
    }

    public long responseTimeThresholdMs() {
        return responseTimeThresholdMs;
    }

    public Instant lastUpdated() {
        return lastUpdated;
    }

    int historySize() {
        return history.size();
    }

    private Duration retention() {
        Duration d = policy.getHistoryRetention();
        return d == null ? Duration.ofHours(24) : d;
    }
}
