package com.example.governance.degradation;

import com.example.governance.recovery.RecoveryAction;

import java.util.List;

/**
 * @param qualityScore               how close to full service the fallback stays (0-1, higher is better)
 * @param estimatedPerformanceImpact expected throughput loss (0-1)
 */
public record FallbackStrategy(String strategyId,
                               String name,
                               String description,
                               List<TriggerCondition> triggerConditions,
                               RecoveryAction fallbackAction,
                               double qualityScore,
                               double estimatedPerformanceImpact) {

    public FallbackStrategy {
        triggerConditions = triggerConditions == null ? List.of() : List.copyOf(triggerConditions);
    }

    public boolean triggered(SystemHealthMetrics metrics) {
        for (TriggerCondition c : triggerConditions) {
            if (c.holds(metrics)) {
                return true;
            }
        }
        return false;
    }
}
