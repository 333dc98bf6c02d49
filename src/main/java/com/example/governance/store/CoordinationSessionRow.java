package com.example.governance.store;

import com.example.governance.coordination.CoordinationStrategy;
import com.example.governance.coordination.RecoveryCoordinationSession;
import com.example.governance.coordination.RecoveryPhase;
import com.example.governance.coordination.RecoveryPlan;
import com.example.governance.error.ErrorContext;

import java.time.Instant;
import java.util.List;

/** {@code recovery_coordination_sessions} row; nested structures are typed, not opaque blobs. */
public record CoordinationSessionRow(String sessionId,
                                     String initiatorAgentId,
                                     List<String> participatingAgents,
                                     ErrorContextData errorContext,
                                     StrategyData coordinationStrategy,
                                     String status,
                                     Instant startedAt,
                                     Instant completedAt,
                                     PlanData recoveryPlan) {

    public static CoordinationSessionRow from(RecoveryCoordinationSession s) {
        return new CoordinationSessionRow(
                s.sessionId(),
                s.initiatorAgentId(),
                s.participatingAgents(),
                ErrorContextData.from(s.errorContext()),
                StrategyData.from(s.coordinationStrategy()),
                s.status().code(),
                s.startedAt(),
                s.completedAt(),
                PlanData.from(s.recoveryPlan()));
    }

    public record ErrorContextData(String errorId,
                                   String agentId,
                                   String agentType,
                                   Instant timestamp,
                                   double memoryUsage,
                                   double cpuUsage) {

        static ErrorContextData from(ErrorContext c) {
            return new ErrorContextData(c.errorId(), c.agentId(), c.agentType(), c.timestamp(),
                    c.environment().memoryUsage(), c.environment().cpuUsage());
        }
    }

    public record StrategyData(String type,
                               String leaderElectionMethod,
                               Integer decisionThreshold,
                               long timeoutMs,
                               int maxRetries,
                               String backoff) {

        static StrategyData from(CoordinationStrategy s) {
            return new StrategyData(s.type().code(),
                    s.leaderElectionMethod() == null ? null : s.leaderElectionMethod().code(),
                    s.decisionThreshold(), s.timeoutMs(),
                    s.retryPolicy().maxAttempts(), s.retryPolicy().backoff().code());
        }
    }

    public record PlanData(String planId, List<String> phaseIds, long estimatedDurationMs) {

        static PlanData from(RecoveryPlan p) {
            if (p == null) {
                return null;
            }
            return new PlanData(p.planId(), p.phases().stream().map(RecoveryPhase::phaseId).toList(),
                    p.estimatedDurationMs());
        }
    }
}
