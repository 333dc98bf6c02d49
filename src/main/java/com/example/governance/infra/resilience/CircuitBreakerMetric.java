package com.example.governance.infra.resilience;

import com.example.governance.error.ErrorType;

import java.time.Instant;

/**
 * One rolling-window sample. {@code errorType} is null for successes.
 */
public record CircuitBreakerMetric(Instant timestamp,
                                   boolean success,
                                   long responseTimeMs,
                                   ErrorType errorType) {

    public static CircuitBreakerMetric success(Instant at, long responseTimeMs) {
        return new CircuitBreakerMetric(at, true, responseTimeMs, null);
    }

    public static CircuitBreakerMetric failure(Instant at, long responseTimeMs, ErrorType type) {
        return new CircuitBreakerMetric(at, false, responseTimeMs, type == null ? ErrorType.SYSTEM_ERROR : type);
    }
}
