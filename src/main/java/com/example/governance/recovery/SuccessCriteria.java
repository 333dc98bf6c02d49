package com.example.governance.recovery;

import com.example.governance.error.ErrorContext;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * What "resolved" means for a strategy or a phase.
 */
public record SuccessCriteria(boolean healthCheckPasses,
                              long responseTimeThresholdMs,
                              double errorRateThreshold,
                              double successRateThreshold,
                              List<CustomCheck> customChecks) {

    public SuccessCriteria {
        customChecks = customChecks == null ? List.of() : List.copyOf(customChecks);
    }

    public static SuccessCriteria healthCheck(boolean healthCheckPasses) {
        return new SuccessCriteria(healthCheckPasses, 5000L, 0.05d, 0.95d, List.of());
    }

    public SuccessCriteria withCustomChecks(List<CustomCheck> checks) {
        return new SuccessCriteria(healthCheckPasses, responseTimeThresholdMs, errorRateThreshold,
                successRateThreshold, checks);
    }

    public record CustomCheck(String name,
                              String description,
                              Function<ErrorContext, CompletableFuture<Boolean>> validator) {
    }
}
