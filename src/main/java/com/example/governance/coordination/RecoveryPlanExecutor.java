package com.example.governance.coordination;

import com.example.governance.infra.resilience.FailureClassifier;
import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.RecoveryActionParams;
import com.example.governance.recovery.RecoveryResult;
import com.example.governance.recovery.SuccessCriteria;
import com.example.governance.recovery.action.ActionExecutionException;
import com.example.governance.recovery.action.RecoveryActionExecutor;
import com.example.governance.transport.AgentTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs a {@link RecoveryPlan} for one session.
 *
 * <p>Phases run in dependency order ({@link RecoveryPlan#dependencies()}) and actions in the
 * order of their {@link RecoveryAction#dependencies()}; list order breaks ties. A plan with an
 * unknown dependency or a cycle fails before any action runs. The session status is checked
 * before every phase, every action and every retry, so an abort stops execution at the next
 * boundary.
 * When an action fails, the rollback-capable phases that ran (the failed one included) are
 * compensated in reverse completion order; only their completed actions are compensated.</p>
 */
@Slf4j
public class RecoveryPlanExecutor {

    static final String ABORTED_MESSAGE = "Session aborted";

    private final RecoveryActionExecutor actionExecutor;
    private final AgentTransport transport;
    private final Duration healthCheckTimeout;
    private final Clock clock;

    public RecoveryPlanExecutor(RecoveryActionExecutor actionExecutor,
                                AgentTransport transport,
                                Duration healthCheckTimeout,
                                Clock clock) {
        this.actionExecutor = actionExecutor;
        this.transport = transport;
        this.healthCheckTimeout = healthCheckTimeout;
        this.clock = clock;
    }

    public RecoveryResult execute(RecoveryCoordinationSession session,
                                  RecoveryPlan plan,
                                  Consumer<CoordinationEvent> recorder) {
        long start = clock.millis();
        String leader = session.leaderAgentId() == null ? session.initiatorAgentId() : session.leaderAgentId();
        List<RecoveryAction> executed = new ArrayList<>();
        List<String> sideEffects = new ArrayList<>();
        Deque<PhaseRun> rollbackCandidates = new ArrayDeque<>();

        List<RecoveryPhase> phases;
        try {
            phases = orderPhases(plan);
            phases.forEach(RecoveryPlanExecutor::orderActions);
        } catch (CoordinationException e) {
            String message = "Invalid plan " + plan.planId() + ": " + e.getMessage();
            log.warn("[plan] {} session={}", message, session.sessionId());
            return new RecoveryResult(false, plan.planId(), List.of(), clock.millis() - start, false,
                    List.of(message), false, message);
        }

        log.info("[plan] executing plan={} session={} phases={}", plan.planId(), session.sessionId(),
                phases.stream().map(RecoveryPhase::phaseId).toList());
        for (RecoveryPhase phase : phases) {
            if (session.isTerminal()) {
                return aborted(plan, executed, sideEffects, start);
            }
            recorder.accept(event(session, leader, CoordinationEventType.PHASE_STARTED, phase.phaseId(), null,
                    Map.of("name", phase.name()), CoordinationEvent.Status.STARTED));

            PhaseRun run = runPhase(session, phase, leader, recorder);
            executed.addAll(run.completedActions());
            if (run.cancelled()) {
                return aborted(plan, executed, sideEffects, start);
            }
            if (!run.success()) {
                String message = "Phase " + phase.phaseId() + " failed: " + run.error();
                sideEffects.add(message);
                recorder.accept(event(session, leader, CoordinationEventType.PHASE_FAILED, phase.phaseId(), null,
                        Map.of("error", run.error()), CoordinationEvent.Status.FAILED));
                if (phase.canRollback()) {
                    rollbackCandidates.push(run);
                }
                rollback(session, plan.rollbackPlan(), rollbackCandidates, leader, recorder, sideEffects);
                log.warn("[plan] {} session={}", message, session.sessionId());
                return new RecoveryResult(false, plan.planId(), executed, clock.millis() - start, false,
                        sideEffects, true, message);
            }
            recorder.accept(event(session, leader, CoordinationEventType.PHASE_COMPLETED, phase.phaseId(), null,
                    Map.of("actions", String.valueOf(run.completedActions().size())), CoordinationEvent.Status.COMPLETED));
            if (phase.canRollback()) {
                rollbackCandidates.push(run);
            }
        }

        List<String> failures = verify(session, plan);
        boolean success = failures.isEmpty();
        sideEffects.addAll(failures);
        log.info("[plan] finished plan={} session={} success={}", plan.planId(), session.sessionId(), success);
        return new RecoveryResult(success, plan.planId(), executed, clock.millis() - start, success,
                sideEffects, !success, success ? null : String.join("; ", failures));
    }

    PhaseRun runPhase(RecoveryCoordinationSession session,
                      RecoveryPhase phase,
                      String leader,
                      Consumer<CoordinationEvent> recorder) {
        long deadline = clock.millis() + phase.timeoutMs();
        List<RecoveryAction> done = new ArrayList<>();
        for (RecoveryAction action : orderActions(phase)) {
            if (session.isTerminal()) {
                return new PhaseRun(phase, done, false, true, ABORTED_MESSAGE);
            }
            if (clock.millis() > deadline) {
                return new PhaseRun(phase, done, false, false, "timeout of " + phase.timeoutMs() + "ms exceeded");
            }
            String target = targetFor(action, phase, leader);
            recorder.accept(event(session, target, CoordinationEventType.ACTION_STARTED, phase.phaseId(),
                    action.actionId(), Map.of("type", action.type().code()), CoordinationEvent.Status.STARTED));
            try {
                if (!runWithRetry(session, action, target, deadline)) {
                    return new PhaseRun(phase, done, false, true, ABORTED_MESSAGE);
                }
                done.add(action);
                recorder.accept(event(session, target, CoordinationEventType.ACTION_COMPLETED, phase.phaseId(),
                        action.actionId(), Map.of("success", "true"), CoordinationEvent.Status.COMPLETED));
            } catch (ActionExecutionException e) {
                recorder.accept(event(session, target, CoordinationEventType.ACTION_FAILED, phase.phaseId(),
                        action.actionId(), Map.of("success", "false", "error", String.valueOf(e.getMessage())),
                        CoordinationEvent.Status.FAILED));
                return new PhaseRun(phase, done, false, false, e.getMessage());
            }
        }
        return new PhaseRun(phase, done, true, false, null);
    }

    /**
     * Transient failures (timeouts, network, rate limits) are retried per the session's policy
     * while the phase deadline allows the backoff. Returns false when the session ended during
     * a backoff.
     */
    private boolean runWithRetry(RecoveryCoordinationSession session, RecoveryAction action, String target, long deadline) {
        RetryPolicy policy = session.coordinationStrategy().retryPolicy();
        int attempt = 1;
        while (true) {
            try {
                actionExecutor.executeAndWait(action, target);
                return true;
            } catch (ActionExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (attempt >= policy.maxAttempts() || !FailureClassifier.classify(cause).isTransient()) {
                    throw e;
                }
                long delay = policy.delayForAttempt(attempt);
                if (clock.millis() + delay > deadline) {
                    throw e;
                }
                log.info("[plan] retrying action={} attempt={} in {}ms: {}", action.actionId(), attempt + 1, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                if (session.isTerminal()) {
                    log.info("[plan] session={} ended during backoff of action={}", session.sessionId(), action.actionId());
                    return false;
                }
                attempt++;
            }
        }
    }

    static List<RecoveryPhase> orderPhases(RecoveryPlan plan) {
        Map<String, List<String>> edges = DependencyOrder.phaseEdges(plan);
        Set<String> known = new LinkedHashSet<>(plan.phaseIds());
        for (String phaseId : edges.keySet()) {
            if (!known.contains(phaseId)) {
                throw new CoordinationException("dependency declared for unknown phase " + phaseId);
            }
        }
        return DependencyOrder.sort(plan.phases(), RecoveryPhase::phaseId,
                p -> edges.getOrDefault(p.phaseId(), List.of()), "phase");
    }

    private static List<RecoveryAction> orderActions(RecoveryPhase phase) {
        return DependencyOrder.sort(phase.actions(), RecoveryAction::actionId, RecoveryAction::dependencies, "action");
    }

    private void rollback(RecoveryCoordinationSession session,
                          RollbackPlan rollbackPlan,
                          Deque<PhaseRun> runs,
                          String leader,
                          Consumer<CoordinationEvent> recorder,
                          List<String> sideEffects) {
        if (runs.isEmpty()) {
            return;
        }
        log.warn("[plan] rolling back phases={} session={}",
                runs.stream().map(r -> r.phase().phaseId()).toList(), session.sessionId());
        recorder.accept(event(session, leader, CoordinationEventType.ROLLBACK_STARTED, null, null,
                Map.of("phases", String.valueOf(runs.size())), CoordinationEvent.Status.STARTED));
        // Deque iteration starts at the most recently pushed run.
        for (PhaseRun run : runs) {
            Optional<RollbackPhase> rollbackPhase = rollbackPlan.forPhase(run.phase().phaseId());
            if (rollbackPhase.isEmpty()) {
                log.debug("[plan] no rollback phase for {}", run.phase().phaseId());
                continue;
            }
            Map<String, RecoveryAction> originals = new HashMap<>();
            run.completedActions().forEach(a -> originals.put("rollback_" + a.actionId(), a));
            List<RecoveryAction> compensations = new ArrayList<>(rollbackPhase.get().actions());
            for (int i = compensations.size() - 1; i >= 0; i--) {
                RecoveryAction compensation = compensations.get(i);
                RecoveryAction original = originals.get(compensation.actionId());
                if (original == null) {
                    continue;
                }
                String target = targetFor(original, run.phase(), leader);
                String phaseId = rollbackPhase.get().phaseId();
                recorder.accept(event(session, target, CoordinationEventType.ACTION_STARTED, phaseId,
                        compensation.actionId(), Map.of("type", compensation.type().code()), CoordinationEvent.Status.STARTED));
                try {
                    actionExecutor.executeAndWait(compensation, target);
                    recorder.accept(event(session, target, CoordinationEventType.ACTION_COMPLETED, phaseId,
                            compensation.actionId(), Map.of("success", "true"), CoordinationEvent.Status.COMPLETED));
                } catch (ActionExecutionException e) {
                    log.error("[plan] rollback action failed id={} session={}: {}",
                            compensation.actionId(), session.sessionId(), e.getMessage());
                    sideEffects.add("Rollback " + e.getMessage());
                    recorder.accept(event(session, target, CoordinationEventType.ACTION_FAILED, phaseId,
                            compensation.actionId(), Map.of("success", "false", "error", String.valueOf(e.getMessage())),
                            CoordinationEvent.Status.FAILED));
                }
            }
        }
        recorder.accept(event(session, leader, CoordinationEventType.ROLLBACK_COMPLETED, null, null,
                Map.of(), CoordinationEvent.Status.COMPLETED));
    }

    /** Returns the failed checks; empty means the plan's success criteria hold. */
    List<String> verify(RecoveryCoordinationSession session, RecoveryPlan plan) {
        SuccessCriteria criteria = plan.successCriteria();
        List<String> failures = new ArrayList<>();
        if (criteria == null) {
            return failures;
        }
        if (criteria.healthCheckPasses()) {
            Set<String> agents = new LinkedHashSet<>();
            plan.phases().forEach(p -> agents.addAll(p.assignedAgents()));
            for (String agent : agents) {
                if (!healthy(agent)) {
                    failures.add("Health check failed for agent " + agent);
                }
            }
        }
        for (SuccessCriteria.CustomCheck check : criteria.customChecks()) {
            boolean passed;
            try {
                passed = Boolean.TRUE.equals(check.validator().apply(session.errorContext())
                        .orTimeout(healthCheckTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .join());
            } catch (RuntimeException e) {
                log.warn("[plan] custom check {} errored: {}", check.name(), e.toString());
                passed = false;
            }
            if (!passed) {
                failures.add("Custom check failed: " + check.name());
            }
        }
        return failures;
    }

    private boolean healthy(String agentId) {
        try {
            return Boolean.TRUE.equals(transport.checkHealth(agentId)
                    .orTimeout(healthCheckTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join());
        } catch (CompletionException e) {
            log.warn("[plan] health check errored agent={}: {}", agentId,
                    e.getCause() == null ? e.toString() : e.getCause().toString());
            return false;
        }
    }

    /**
     * Restarts go to the agent named in the action; everything else goes to the leader when
     * the leader is assigned to the phase, otherwise to the phase's first agent.
     */
    static String targetFor(RecoveryAction action, RecoveryPhase phase, String leader) {
        if (action.params() instanceof RecoveryActionParams.AgentRestart restart && restart.agentId() != null) {
            return restart.agentId();
        }
        if (leader != null && phase.assignedAgents().contains(leader)) {
            return leader;
        }
        return phase.assignedAgents().isEmpty() ? leader : phase.assignedAgents().get(0);
    }

    private RecoveryResult aborted(RecoveryPlan plan, List<RecoveryAction> executed, List<String> sideEffects, long start) {
        List<String> effects = new ArrayList<>(sideEffects);
        effects.add(ABORTED_MESSAGE);
        return new RecoveryResult(false, plan.planId(), executed, clock.millis() - start, false, effects, false,
                ABORTED_MESSAGE);
    }

    private CoordinationEvent event(RecoveryCoordinationSession session,
                                    String agentId,
                                    CoordinationEventType type,
                                    String phaseId,
                                    String actionId,
                                    Map<String, String> data,
                                    CoordinationEvent.Status status) {
        String subject = actionId != null ? actionId : phaseId != null ? phaseId : "plan";
        return new CoordinationEvent(session.sessionId() + "_" + subject + "_" + type.code(),
                session.sessionId(), clock.instant(), agentId, type, phaseId, actionId, data, status);
    }

    record PhaseRun(RecoveryPhase phase,
                    List<RecoveryAction> completedActions,
                    boolean success,
                    boolean cancelled,
                    String error) {

        PhaseRun {
            completedActions = List.copyOf(completedActions);
        }
    }
}
