package com.example.governance.recovery;

import com.example.governance.error.ErrorClassification;
import com.example.governance.error.ErrorSeverity;
import com.example.governance.error.ImpactScope;

import java.util.List;

/**
 * Scores candidate strategies. Candidates arrive sorted by priority; equal scores keep
 * that order.
 */
public class RecoveryStrategySelector {

    public RecoveryStrategy selectBestStrategy(List<RecoveryStrategy> candidates, ErrorClassification classification) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No strategies available");
        }
        RecoveryStrategy best = candidates.get(0);
        double bestScore = score(best, classification);
        for (int i = 1; i < candidates.size(); i++) {
            double s = score(candidates.get(i), classification);
            if (s > bestScore) {
                best = candidates.get(i);
                bestScore = s;
            }
        }
        return best;
    }

    double score(RecoveryStrategy strategy, ErrorClassification classification) {
        double score = strategy.priority();
        if (classification.requiresImmediateAttention()) {
            score += (60_000d - strategy.estimatedRecoveryTimeMs()) / 1000d;
        }
        if (classification.severity() == ErrorSeverity.CRITICAL || classification.severity() == ErrorSeverity.EMERGENCY) {
            score += 20;
        }
        if (classification.impactScope() == ImpactScope.SYSTEM_WIDE) {
            score += 15;
        }
        return score;
    }
}
