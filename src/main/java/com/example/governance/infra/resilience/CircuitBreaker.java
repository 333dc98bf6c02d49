package com.example.governance.infra.resilience;

import com.example.governance.error.ErrorContext;
import com.example.governance.error.ErrorType;
import com.example.governance.observability.ReliabilityEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Named circuit breaker with a time/count bounded rolling window and adaptive thresholds.
 *
 * <ul>
 *     <li>CLOSED: executes, trips to OPEN when the window failure percentage reaches the
 *     current threshold and the window holds at least {@code minimumThroughput} samples</li>
 *     <li>OPEN: fails fast with {@link OpenCircuitException}; promoted to HALF_OPEN by
 *     {@link #evaluateState()} once {@code nextAttemptTime} has passed</li>
 *     <li>HALF_OPEN: executes; closes on enough successes among the most recent samples,
 *     reopens on any failure</li>
 * </ul>
 *
 * <p>State mutation is serialized by a per-instance lock. The guarded operation itself
 * always runs outside the lock, so a slow call never blocks other callers' bookkeeping.</p>
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public static final String EVENT_SOURCE = "circuit_breaker";

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReliabilityEventPublisher events;
    private final ReentrantLock lock = new ReentrantLock();

    private final Deque<CircuitBreakerMetric> window = new ArrayDeque<>();
    private final AdaptiveThresholds adaptive;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private Instant nextAttemptTime;

    private long totalRequests;
    private long totalSuccesses;
    private long totalFailures;
    private long rejectedRequests;
    private double averageResponseTimeMs;

    public CircuitBreaker(String name,
                          CircuitBreakerConfig config,
                          CircuitBreakerProperties.Adaptive adaptivePolicy,
                          Clock clock,
                          ReliabilityEventPublisher events) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = config == null ? CircuitBreakerConfig.defaults() : config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.events = events;
        this.adaptive = new AdaptiveThresholds(this.config.errorThresholdPercentage(), adaptivePolicy, this.clock.instant());
    }

    public String name() {
        return name;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    /**
     * Runs {@code operation} under breaker protection.
     *
     * @throws OpenCircuitException when the breaker is OPEN (the operation is not invoked)
     * @throws Exception            whatever the operation threw, unchanged, after being recorded
     */
    public <T> T call(Callable<T> operation, ErrorContext context) throws Exception {
        Objects.requireNonNull(operation, "operation");
        lock.lock();
        try {
            if (state == CircuitState.OPEN) {
                rejectedRequests++;
                Instant now = clock.instant();
                Duration remaining = nextAttemptTime == null || now.isAfter(nextAttemptTime)
                        ? Duration.ZERO
                        : Duration.between(now, nextAttemptTime);
                if (log.isDebugEnabled()) {
                    log.debug("[breaker] short-circuit name={} errorId={} remaining={}",
                            name, context == null ? null : context.errorId(), remaining);
                }
                throw new OpenCircuitException(name, remaining);
            }
        } finally {
            lock.unlock();
        }

        long start = clock.millis();
        T result;
        try {
            result = operation.call();
        } catch (Exception e) {
            onFailure(Math.max(0L, clock.millis() - start), e);
            throw e;
        }
        onSuccess(Math.max(0L, clock.millis() - start));
        return result;
    }

    private void onSuccess(long responseTimeMs) {
        String transition = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            successCount++;
            lastSuccessTime = now;
            CircuitBreakerMetric sample = CircuitBreakerMetric.success(now, responseTimeMs);
            addSample(sample);
            adaptive.record(sample);
            if (state == CircuitState.HALF_OPEN && shouldClose()) {
                closeLocked();
                transition = "closed";
            }
        } finally {
            lock.unlock();
        }
        emit(transition, Map.of());
    }

    private void onFailure(long responseTimeMs, Exception error) {
        String transition = null;
        ErrorType type = FailureClassifier.classify(error);
        lock.lock();
        try {
            Instant now = clock.instant();
            failureCount++;
            lastFailureTime = now;
            CircuitBreakerMetric sample = CircuitBreakerMetric.failure(now, responseTimeMs, type);
            addSample(sample);
            adaptive.record(sample);
            if (state == CircuitState.HALF_OPEN) {
                openLocked(now, config.recoveryTimeout());
                transition = "opened";
            } else if (state == CircuitState.CLOSED && shouldOpen(now)) {
                openLocked(now, config.recoveryTimeout());
                transition = "opened";
            }
        } finally {
            lock.unlock();
        }
        if (transition != null) {
            log.warn("[breaker] OPEN name={} lastError={} ({})", name, type.code(), error.toString());
        }
        emit(transition, Map.of("error_type", type.code()));
    }

    private boolean shouldOpen(Instant now) {
        List<CircuitBreakerMetric> recent = recentLocked(now);
        if (recent.size() < config.minimumThroughput()) {
            return false;
        }
        long failures = recent.stream().filter(m -> !m.success()).count();
        double pct = failures * 100d / recent.size();
        return pct >= adaptive.failureThreshold();
    }

    private boolean shouldClose() {
        int probe = config.halfOpenProbeWindow();
        int seen = 0;
        int successes = 0;
        Iterator<CircuitBreakerMetric> it = window.descendingIterator();
        while (it.hasNext() && seen < probe) {
            if (it.next().success()) {
                successes++;
            }
            seen++;
        }
        return successes >= config.halfOpenSuccessThreshold();
    }

    private void addSample(CircuitBreakerMetric sample) {
        window.addLast(sample);
        while (window.size() > config.maxWindowSamples()) {
            window.removeFirst();
        }
        totalRequests++;
        if (sample.success()) {
            totalSuccesses++;
        } else {
            totalFailures++;
        }
        averageResponseTimeMs += (sample.responseTimeMs() - averageResponseTimeMs) / totalRequests;
    }

    private List<CircuitBreakerMetric> recentLocked(Instant now) {
        Instant cutoff = now.minus(config.rollingWindow());
        List<CircuitBreakerMetric> out = new ArrayList<>(window.size());
        for (CircuitBreakerMetric m : window) {
            if (m.timestamp().isAfter(cutoff)) {
                out.add(m);
            }
        }
        return out;
    }

    private void openLocked(Instant now, Duration openFor) {
        state = CircuitState.OPEN;
        nextAttemptTime = now.plus(openFor);
    }

    private void closeLocked() {
        state = CircuitState.CLOSED;
        failureCount = 0;
        nextAttemptTime = null;
        window.clear();
    }

    /**
     * Periodic tick: OPEN → HALF_OPEN promotion, threshold adaptation and trimming of samples
     * older than twice the rolling window.
     */
    public void evaluateState() {
        String transition = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == CircuitState.OPEN && nextAttemptTime != null && !now.isBefore(nextAttemptTime)) {
                state = CircuitState.HALF_OPEN;
                transition = "half_open";
            }
            adaptive.update(recentLocked(now), now);
            Instant cutoff = now.minus(config.rollingWindow().multipliedBy(2));
            while (!window.isEmpty() && window.peekFirst().timestamp().isBefore(cutoff)) {
                window.removeFirst();
            }
        } finally {
            lock.unlock();
        }
        if (transition != null) {
            log.info("[breaker] HALF_OPEN name={}", name);
        }
        emit(transition, Map.of());
    }

    public void reset() {
        lock.lock();
        try {
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            lastFailureTime = null;
            lastSuccessTime = null;
            nextAttemptTime = null;
            window.clear();
            adaptive.reset(clock.instant());
        } finally {
            lock.unlock();
        }
        log.info("[breaker] reset name={}", name);
        emit("reset", Map.of());
    }

    public void forceOpen() {
        forceOpen(config.recoveryTimeout());
    }

    /** Opens the breaker for {@code openFor} regardless of the window contents. */
    public void forceOpen(Duration openFor) {
        Duration d = openFor == null || openFor.isNegative() || openFor.isZero() ? config.recoveryTimeout() : openFor;
        lock.lock();
        try {
            Instant now = clock.instant();
            lastFailureTime = now;
            openLocked(now, d);
        } finally {
            lock.unlock();
        }
        log.info("[breaker] forcing OPEN name={} for={}", name, d);
        emit("forced_open", Map.of("open_for_ms", d.toMillis()));
    }

    public void forceClose() {
        lock.lock();
        try {
            closeLocked();
            lastFailureTime = null;
        } finally {
            lock.unlock();
        }
        log.info("[breaker] forcing CLOSED name={}", name);
        emit("forced_close", Map.of());
    }

    public CircuitState currentState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen() {
        return currentState() == CircuitState.OPEN;
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return new CircuitBreakerState(
                    name,
                    state,
                    failureCount,
                    successCount,
                    lastFailureTime,
                    lastSuccessTime,
                    nextAttemptTime,
                    new ArrayList<>(window),
                    adaptive.failureThreshold(),
                    adaptive.responseTimeThresholdMs());
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerMetricsSummary getDetailedMetrics() {
        lock.lock();
        try {
            int size = window.size();
            long ok = window.stream().filter(CircuitBreakerMetric::success).count();
            return new CircuitBreakerMetricsSummary(
                    name,
                    state,
                    totalRequests,
                    totalSuccesses,
                    totalFailures,
                    rejectedRequests,
                    averageResponseTimeMs,
                    size,
                    size == 0 ? 1d : (double) ok / size,
                    adaptive.failureThreshold(),
                    adaptive.responseTimeThresholdMs());
        } finally {
            lock.unlock();
        }
    }

    private void emit(String type, Map<String, Object> extra) {
        if (type == null || events == null) {
            return;
        }
        Map<String, Object> data = new HashMap<>(extra);
        data.put("name", name);
        events.publish(EVENT_SOURCE, type, name, data);
    }
}
