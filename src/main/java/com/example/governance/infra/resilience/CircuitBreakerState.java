package com.example.governance.infra.resilience;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a breaker. Mutating it has no effect on the breaker.
 */
public record CircuitBreakerState(String name,
                                  CircuitState state,
                                  int failureCount,
                                  int successCount,
                                  Instant lastFailureTime,
                                  Instant lastSuccessTime,
                                  Instant nextAttemptTime,
                                  List<CircuitBreakerMetric> rollingWindow,
                                  double failureThresholdPercentage,
                                  long responseTimeThresholdMs) {

    public CircuitBreakerState {
        rollingWindow = rollingWindow == null ? List.of() : List.copyOf(rollingWindow);
    }
}
