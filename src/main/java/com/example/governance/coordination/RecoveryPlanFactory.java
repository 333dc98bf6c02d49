package com.example.governance.coordination;

import com.example.governance.error.ErrorContext;
import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.RecoveryActionParams;
import com.example.governance.recovery.RecoveryActionType;
import com.example.governance.recovery.SuccessCriteria;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the four-phase plan (assessment, stabilization, recovery, verification) for a
 * coordinated recovery, with sequential phase dependencies and a compensating rollback plan.
 */
public class RecoveryPlanFactory {

    static final double MEMORY_PRESSURE_PERCENT = 80d;

    private final Clock clock;

    public RecoveryPlanFactory(Clock clock) {
        this.clock = clock;
    }

    public String newSessionId(ErrorContext error) {
        return "recovery_" + error.errorId() + "_" + clock.millis();
    }

    public RecoveryPlan createPlan(ErrorContext error, List<String> agents) {
        List<RecoveryPhase> phases = phases(error, agents);
        long estimated = phases.stream().mapToLong(RecoveryPhase::timeoutMs).sum();
        return new RecoveryPlan(
                "plan_" + error.errorId() + "_" + clock.millis(),
                phases,
                dependencies(phases),
                rollbackPlan(phases),
                estimated,
                new SuccessCriteria(true, 5_000L, 0.05d, 0.95d, List.of()));
    }

    List<RecoveryPhase> phases(ErrorContext error, List<String> agents) {
        List<RecoveryPhase> phases = new ArrayList<>(4);
        phases.add(new RecoveryPhase(
                "assessment",
                "Assessment and Preparation",
                "Assess current state and prepare for recovery",
                List.of(error.agentId()),
                List.of(RecoveryAction.of("assess_system_state", RecoveryActionType.FALLBACK_MODE,
                        "Assess current system state",
                        new RecoveryActionParams.FallbackMode("assessment", null, Map.of("assessment_type", "comprehensive")),
                        30_000L)),
                60_000L,
                new SuccessCriteria(false, 10_000L, 1.0d, 0.0d, List.of()),
                false));

        RecoveryAction breakers = RecoveryAction.of("activate_circuit_breakers", RecoveryActionType.CIRCUIT_BREAKER_OPEN,
                "Activate circuit breakers to prevent cascade failures",
                new RecoveryActionParams.CircuitToggle(null, 30_000L, "system_wide"),
                15_000L);
        RecoveryAction degraded = new RecoveryAction("enable_degraded_mode", RecoveryActionType.FALLBACK_MODE,
                "Enable graceful degradation",
                new RecoveryActionParams.FallbackMode("degraded", 2, Map.of()),
                30_000L,
                List.of(breakers.actionId()));
        phases.add(new RecoveryPhase(
                "stabilization",
                "System Stabilization",
                "Stabilize system and stop error propagation",
                agents.subList(0, Math.min(2, agents.size())),
                List.of(breakers, degraded),
                120_000L,
                new SuccessCriteria(false, 15_000L, 0.5d, 0.5d, List.of()),
                true));

        phases.add(new RecoveryPhase(
                "recovery",
                "Recovery Execution",
                "Execute primary recovery actions",
                agents,
                recoveryActions(error),
                300_000L,
                new SuccessCriteria(true, 8_000L, 0.1d, 0.8d, List.of()),
                true));

        RecoveryAction verify = RecoveryAction.of("verify_system_health", RecoveryActionType.FALLBACK_MODE,
                "Comprehensive system health verification",
                new RecoveryActionParams.FallbackMode("verification", null, Map.of("verification_depth", "full")),
                60_000L);
        RecoveryAction restore = new RecoveryAction("restore_full_service", RecoveryActionType.FALLBACK_MODE,
                "Restore full service functionality",
                new RecoveryActionParams.FallbackMode("restore", null, Map.of("restoration_mode", "gradual")),
                120_000L,
                List.of(verify.actionId()));
        phases.add(new RecoveryPhase(
                "verification",
                "Verification and Restoration",
                "Verify recovery and restore full functionality",
                List.of(error.agentId()),
                List.of(verify, restore),
                200_000L,
                new SuccessCriteria(true, 5_000L, 0.05d, 0.95d, List.of()),
                false));
        return phases;
    }

    /** Targeted actions first, agent restart last and dependent on all of them. */
    List<RecoveryAction> recoveryActions(ErrorContext error) {
        List<RecoveryAction> actions = new ArrayList<>();
        if (error.stackTraceContains("database") || error.stackTraceContains("sql")) {
            actions.add(RecoveryAction.of("reset_database_connections", RecoveryActionType.RESET_CONNECTIONS,
                    "Reset database connection pool",
                    new RecoveryActionParams.ConnectionReset("database"),
                    60_000L));
        }
        if (error.environment().memoryUsage() > MEMORY_PRESSURE_PERCENT) {
            actions.add(RecoveryAction.of("trigger_garbage_collection", RecoveryActionType.CLEAR_CACHE,
                    "Trigger garbage collection and clear caches",
                    new RecoveryActionParams.CacheClear(List.of("gc")),
                    30_000L));
        }
        List<String> before = actions.stream().map(RecoveryAction::actionId).toList();
        actions.add(new RecoveryAction("restart_agent_if_needed", RecoveryActionType.RESTART_AGENT,
                "Restart agent if other recovery actions fail",
                new RecoveryActionParams.AgentRestart(error.agentId(), "if_needed"),
                120_000L,
                before));
        return actions;
    }

    private static List<PhaseDependency> dependencies(List<RecoveryPhase> phases) {
        List<PhaseDependency> deps = new ArrayList<>();
        for (int i = 1; i < phases.size(); i++) {
            deps.add(new PhaseDependency(phases.get(i).phaseId(), List.of(phases.get(i - 1).phaseId()),
                    PhaseDependency.Type.SEQUENTIAL));
        }
        return deps;
    }

    private static RollbackPlan rollbackPlan(List<RecoveryPhase> phases) {
        List<RollbackPhase> rollback = new ArrayList<>();
        for (int i = phases.size() - 1; i >= 0; i--) {
            RecoveryPhase phase = phases.get(i);
            if (!phase.canRollback()) {
                continue;
            }
            List<RecoveryAction> actions = phase.actions().stream()
                    .map(a -> a.toRollback(Math.round(a.timeoutMs() * 0.5d)))
                    .toList();
            rollback.add(new RollbackPhase("rollback_" + phase.phaseId(), phase.phaseId(), actions,
                    Math.round(phase.timeoutMs() * 0.5d)));
        }
        long total = rollback.stream().mapToLong(RollbackPhase::timeoutMs).sum();
        return new RollbackPlan(rollback, total);
    }
}
