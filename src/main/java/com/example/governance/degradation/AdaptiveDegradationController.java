package com.example.governance.degradation;

import com.example.governance.error.ErrorSeverity;

/**
 * Heuristic target-level picker.
 *
 * <ul>
 *     <li>+1 level by default</li>
 *     <li>+2 levels for severe triggers (error rate, cpu or memory above the severe thresholds,
 *     critical/emergency error severity)</li>
 *     <li>straight to the top level for the {@code emergency} trigger</li>
 *     <li>never more than +1 while levels are flapping</li>
 * </ul>
 */
public class AdaptiveDegradationController {

    public static final String ERROR_SEVERITY_METRIC = "error_severity";
    public static final String EMERGENCY_METRIC = "emergency";

    private final DegradationProperties props;

    public AdaptiveDegradationController(DegradationProperties props) {
        this.props = props == null ? new DegradationProperties() : props;
    }

    public LevelRecommendation recommendLevel(TriggerCondition trigger, int currentLevel, int maxLevel,
                                              DegradationMetrics metrics) {
        String metric = trigger.metric();
        double value = trigger.effectiveValue();
        DegradationProperties.Severe severe = props.getSevere();

        int step = 1;
        String reason = "Escalating due to " + metric + " threshold exceeded";
        if (EMERGENCY_METRIC.equals(metric)) {
            step = maxLevel - currentLevel;
            reason = "Emergency escalation";
        } else if ((SystemHealthMetrics.ERROR_RATE.equals(metric) && value > severe.getErrorRate())
                || (SystemHealthMetrics.CPU_USAGE.equals(metric) && value > severe.getCpuUsage())
                || (SystemHealthMetrics.MEMORY_USAGE.equals(metric) && value > severe.getMemoryUsage())
                || (ERROR_SEVERITY_METRIC.equals(metric) && value >= ErrorSeverity.CRITICAL.rank())) {
            step = 2;
            reason = "Severe " + metric + " (" + value + ")";
        }

        int target = Math.min(maxLevel, currentLevel + Math.max(1, step));
        if (metrics != null && metrics.changesLastHour() > props.getAntiFlapChangesPerHour()) {
            target = Math.min(target, currentLevel + 1);
            reason = reason + "; limited to one step (" + metrics.changesLastHour() + " changes in the last hour)";
        }
        return new LevelRecommendation(Math.min(maxLevel, target), 0.8d, reason);
    }
}
