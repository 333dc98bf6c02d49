package com.example.governance.recovery;

import com.example.governance.error.ErrorContext;
import com.example.governance.recovery.action.ActionExecutionException;
import com.example.governance.recovery.action.RecoveryActionExecutor;
import com.example.governance.transport.AgentTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a strategy's actions in order against the failing agent. The first failed action
 * stops the run and the remaining actions are reported as skipped.
 */
@Slf4j
public class RecoveryStrategyExecutor {

    /** Receives {@code started}, {@code completed}, {@code failed} and {@code skipped} per action. */
    @FunctionalInterface
    public interface ActionUpdateListener {
        void onUpdate(RecoveryAction action, String status);
    }

    private final RecoveryActionExecutor actionExecutor;
    private final AgentTransport transport;
    private final Duration healthCheckTimeout;
    private final Clock clock;

    public RecoveryStrategyExecutor(RecoveryActionExecutor actionExecutor,
                                    AgentTransport transport,
                                    Duration healthCheckTimeout,
                                    Clock clock) {
        this.actionExecutor = actionExecutor;
        this.transport = transport;
        this.healthCheckTimeout = healthCheckTimeout;
        this.clock = clock;
    }

    public RecoveryResult execute(RecoveryStrategy strategy,
                                  List<RecoveryAction> actions,
                                  ErrorContext error,
                                  ActionUpdateListener listener) {
        long start = clock.millis();
        List<RecoveryAction> executed = new ArrayList<>();
        List<String> sideEffects = new ArrayList<>();
        boolean actionFailed = false;

        log.debug("[recovery] executing {} actions strategy={} error={}", actions.size(), strategy.strategyId(), error.errorId());
        for (RecoveryAction action : actions) {
            if (actionFailed) {
                listener.onUpdate(action, "skipped");
                continue;
            }
            listener.onUpdate(action, "started");
            try {
                actionExecutor.executeAndWait(action, error.agentId());
                executed.add(action);
                listener.onUpdate(action, "completed");
            } catch (ActionExecutionException e) {
                log.error("[recovery] action failed id={} type={}: {}", action.actionId(), action.type().code(), e.getMessage());
                listener.onUpdate(action, "failed");
                sideEffects.add(e.getMessage());
                actionFailed = true;
            }
        }

        List<String> failedChecks = verify(strategy.successCriteria(), error);
        boolean resolved = failedChecks.isEmpty();
        sideEffects.addAll(failedChecks);
        boolean rollbackRequired = actionFailed && !resolved;
        if (rollbackRequired && strategy.rollbackStrategy() != null) {
            rollback(strategy.rollbackStrategy(), error);
        }
        String failure = resolved ? null : String.join("; ", sideEffects);
        return new RecoveryResult(resolved, strategy.strategyId(), executed, clock.millis() - start, resolved,
                sideEffects, rollbackRequired, failure);
    }

    /** Returns the failed checks; empty means the criteria hold. */
    List<String> verify(SuccessCriteria criteria, ErrorContext error) {
        List<String> failures = new ArrayList<>();
        if (criteria.healthCheckPasses() && !healthy(error.agentId())) {
            failures.add("Health check failed");
        }
        for (SuccessCriteria.CustomCheck check : criteria.customChecks()) {
            try {
                Boolean passed = check.validator().apply(error)
                        .orTimeout(healthCheckTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .join();
                if (!Boolean.TRUE.equals(passed)) {
                    failures.add("Custom check failed: " + check.name());
                }
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                failures.add("Custom check error: " + check.name() + " - " + cause);
            }
        }
        return failures;
    }

    private boolean healthy(String agentId) {
        try {
            return Boolean.TRUE.equals(transport.checkHealth(agentId)
                    .orTimeout(healthCheckTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join());
        } catch (RuntimeException e) {
            log.warn("[recovery] health check errored agent={}: {}", agentId, e.toString());
            return false;
        }
    }

    private void rollback(RollbackStrategy rollback, ErrorContext error) {
        log.warn("[recovery] executing rollback strategy={} error={}", rollback.strategyId(), error.errorId());
        for (RecoveryAction action : rollback.actions()) {
            try {
                actionExecutor.executeAndWait(action, error.agentId());
            } catch (ActionExecutionException e) {
                log.error("[recovery] rollback action failed id={}: {}", action.actionId(), e.getMessage());
            }
        }
    }
}
