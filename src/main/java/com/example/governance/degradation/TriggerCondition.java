package com.example.governance.degradation;

import java.util.Objects;

/**
 * Metric threshold that causes escalation or activates a fallback.
 *
 * @param observedValue value that fired the trigger, when known; severity heuristics use it
 *                      in preference to the threshold
 */
public record TriggerCondition(String metric,
                               TriggerOperator operator,
                               double threshold,
                               Double observedValue,
                               long windowSizeMs) {

    public TriggerCondition {
        Objects.requireNonNull(metric, "metric");
        operator = operator == null ? TriggerOperator.GT : operator;
    }

    public static TriggerCondition gt(String metric, double threshold, long windowSizeMs) {
        return new TriggerCondition(metric, TriggerOperator.GT, threshold, null, windowSizeMs);
    }

    public TriggerCondition observed(double value) {
        return new TriggerCondition(metric, operator, threshold, value, windowSizeMs);
    }

    public double effectiveValue() {
        return observedValue != null ? observedValue : threshold;
    }

    public boolean holds(SystemHealthMetrics metrics) {
        if (metrics == null) {
            return false;
        }
        return operator.test(metrics.value(metric), threshold);
    }
}
