package com.example.governance.infra.resilience;

/**
 * Lifetime aggregates plus the current window success rate.
 *
 * @param rejectedRequests calls short-circuited while OPEN (never part of the rolling window)
 */
public record CircuitBreakerMetricsSummary(String name,
                                           CircuitState state,
                                           long totalRequests,
                                           long totalSuccesses,
                                           long totalFailures,
                                           long rejectedRequests,
                                           double averageResponseTimeMs,
                                           int windowSize,
                                           double windowSuccessRate,
                                           double failureThresholdPercentage,
                                           long responseTimeThresholdMs) {
}
