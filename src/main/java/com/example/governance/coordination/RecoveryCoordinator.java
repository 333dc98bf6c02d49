package com.example.governance.coordination;

import com.example.governance.error.ErrorContext;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.recovery.RecoveryResult;
import com.example.governance.store.CoordinationEventRow;
import com.example.governance.store.CoordinationSessionRow;
import com.example.governance.store.ReliabilityStore;
import com.example.governance.transport.AgentNotification;
import com.example.governance.transport.AgentTransport;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Multi-agent recovery sessions: initiation, joining, execution, monitoring and abort.
 *
 * <p>Sessions are independent; each one synchronizes on itself. Finished sessions leave the
 * active set but stay readable for a while through {@link #getSession(String)} and
 * {@link #monitorRecoveryProgress(String)}.</p>
 */
@Slf4j
public class RecoveryCoordinator {

    public static final String EVENT_SOURCE = "coordination";

    private final AgentTransport transport;
    private final RecoveryPlanFactory planFactory;
    private final LeaderElection leaderElection;
    private final ConsensusManager consensusManager;
    private final RecoveryPlanExecutor planExecutor;
    private final ReliabilityStore store;
    private final ReliabilityEventPublisher events;
    private final CoordinationProperties props;
    private final Clock clock;

    private final Map<String, RecoveryCoordinationSession> activeSessions = new ConcurrentHashMap<>();
    private final Cache<String, RecoveryCoordinationSession> finishedSessions;

    public RecoveryCoordinator(AgentTransport transport,
                               RecoveryPlanFactory planFactory,
                               LeaderElection leaderElection,
                               ConsensusManager consensusManager,
                               RecoveryPlanExecutor planExecutor,
                               ReliabilityStore store,
                               ReliabilityEventPublisher events,
                               CoordinationProperties props,
                               Clock clock) {
        this.transport = transport;
        this.planFactory = planFactory;
        this.leaderElection = leaderElection;
        this.consensusManager = consensusManager;
        this.planExecutor = planExecutor;
        this.store = store;
        this.events = events;
        this.props = props == null ? new CoordinationProperties() : props;
        this.clock = clock;
        this.finishedSessions = Caffeine.newBuilder()
                .expireAfterWrite(this.props.getFinishedSessionRetention())
                .maximumSize(this.props.getMaxFinishedSessions())
                .build();
    }

    /**
     * Creates a session for the healthy subset of {@code candidateAgents} and leaves it in
     * PLANNING.
     *
     * @throws CoordinationException when no candidate passes its health check
     */
    public RecoveryCoordinationSession initiateRecovery(ErrorContext error, List<String> candidateAgents) {
        String sessionId = planFactory.newSessionId(error);
        log.info("[coordination] initiating session={} error={} candidates={} initiator={}",
                sessionId, error.errorId(), candidateAgents.size(), error.agentId());

        List<String> agents = healthyAgents(candidateAgents);
        if (agents.isEmpty()) {
            throw new CoordinationException("No valid participating agents found for error " + error.errorId());
        }
        CoordinationStrategy strategy = strategyFor(agents.size());
        RecoveryPlan plan = planFactory.createPlan(error, agents);
        RecoveryCoordinationSession session = new RecoveryCoordinationSession(
                sessionId, error, agents, strategy, plan, clock.instant());

        activeSessions.put(sessionId, session);
        persist(session);
        notifyAll(session, new AgentNotification("recovery_session_created", sessionId, Map.of(
                "error_id", error.errorId(),
                "initiator", error.agentId(),
                "coordination_type", strategy.type().code())));
        record(session, event(session, error.agentId(), CoordinationEventType.SESSION_STARTED,
                Map.of("session_id", sessionId)));
        session.transitionTo(CoordinationStatus.PLANNING, clock.instant());

        events.publish(EVENT_SOURCE, "recovery_session_initiated", sessionId, Map.of(
                "error_id", error.errorId(),
                "agents", agents.size(),
                "strategy", strategy.type().code()));
        return session;
    }

    /**
     * 1 agent: centralized; up to 3: hierarchical; more: consensus with a 60% approval threshold.
     */
    public CoordinationStrategy strategyFor(int agentCount) {
        if (agentCount <= 1) {
            return CoordinationStrategy.centralized();
        }
        if (agentCount <= 3) {
            return CoordinationStrategy.hierarchical();
        }
        return CoordinationStrategy.consensus((int) Math.ceil(agentCount * props.getConsensusRatio()));
    }

    /**
     * @throws CoordinationException for an unknown session, a session past PLANNING, or an
     *                               agent that was not selected as a participant
     */
    public void joinRecoverySession(String sessionId, String agentId) {
        RecoveryCoordinationSession session = requireActive(sessionId);
        synchronized (session) {
            if (session.status() != CoordinationStatus.PLANNING) {
                throw new CoordinationException("Cannot join session " + sessionId + " in status: " + session.status().code());
            }
            if (!session.isParticipant(agentId)) {
                throw new CoordinationException("Agent " + agentId + " not authorized to join session " + sessionId);
            }
            record(session, event(session, agentId, CoordinationEventType.AGENT_JOINED, Map.of("agent_id", agentId)));
        }
        log.info("[coordination] agent joined session={} agent={}", sessionId, agentId);
        events.publish(EVENT_SOURCE, "agent_joined_session", sessionId, Map.of("agent_id", agentId));
    }

    /**
     * Runs the session's plan to completion. Failures are reported in the result, never thrown.
     */
    public RecoveryResult executeCoordinatedRecovery(String sessionId) {
        long start = clock.millis();
        RecoveryCoordinationSession session = activeSessions.get(sessionId);
        if (session == null) {
            return RecoveryResult.failed("Recovery session not found: " + sessionId, 0L);
        }
        if (!session.transitionTo(CoordinationStatus.EXECUTING, clock.instant())) {
            return RecoveryResult.failed("Cannot execute session " + sessionId + " in status: " + session.status().code(),
                    clock.millis() - start);
        }
        log.info("[coordination] executing session={} strategy={}", sessionId, session.coordinationStrategy().type().code());

        RecoveryResult result;
        try {
            String leader = leaderElection.electLeader(session.participatingAgents(), session.coordinationStrategy());
            session.assignLeader(leader);
            record(session, event(session, leader, CoordinationEventType.LEADER_ELECTED, Map.of("leader", leader)));

            if (session.coordinationStrategy().type() == CoordinationType.CONSENSUS) {
                ConsensusManager.Outcome outcome = consensusManager.reachConsensus(
                        session.recoveryPlan(), session.participatingAgents(), session.coordinationStrategy());
                session.replacePlan(outcome.plan());
                record(session, event(session, leader,
                        outcome.reached() ? CoordinationEventType.CONSENSUS_REACHED : CoordinationEventType.CONSENSUS_FAILED,
                        Map.of("approvals", String.valueOf(outcome.approvals()),
                                "votes", String.valueOf(outcome.votesCast()),
                                "threshold", String.valueOf(outcome.threshold()),
                                "plan_id", outcome.plan().planId())));
            }
            result = planExecutor.execute(session, session.recoveryPlan(), e -> record(session, e));
        } catch (RuntimeException e) {
            log.error("[coordination] execution errored session={}: {}", sessionId, e.toString());
            String plan = session.recoveryPlan() == null ? null : session.recoveryPlan().planId();
            result = RecoveryResult.failed(plan, String.valueOf(e.getMessage()), clock.millis() - start);
        }
        RecoveryResult timed = withDuration(result, clock.millis() - start);

        boolean completed = session.transitionTo(
                timed.success() ? CoordinationStatus.COMPLETED : CoordinationStatus.FAILED, clock.instant());
        if (!completed) {
            // Aborted while running; the abort path already recorded and cleaned up.
            log.info("[coordination] session={} ended as {}", sessionId, session.status().code());
            return timed;
        }
        record(session, event(session, session.leaderAgentId(),
                timed.success() ? CoordinationEventType.SESSION_COMPLETED : CoordinationEventType.SESSION_FAILED,
                timed.error() == null ? Map.of() : Map.of("error", timed.error())));
        cleanup(session);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("duration_ms", timed.durationMs());
        data.put("actions", timed.actionsExecuted().size());
        data.put("error", timed.error());
        events.publish(EVENT_SOURCE, timed.success() ? "recovery_session_completed" : "recovery_session_failed",
                sessionId, data);
        log.info("[coordination] session={} success={} duration={}ms", sessionId, timed.success(), timed.durationMs());
        return timed;
    }

    /**
     * @return a copy of the session's event log
     * @throws CoordinationException for an unknown session
     */
    public List<CoordinationEvent> monitorRecoveryProgress(String sessionId) {
        return getSession(sessionId)
                .map(RecoveryCoordinationSession::executionLog)
                .orElseThrow(() -> new CoordinationException("Recovery session not found: " + sessionId));
    }

    /**
     * Moves an active session to ABORTED. An execution in flight stops at its next phase or
     * action boundary.
     *
     * @throws CoordinationException for an unknown or already finished session
     */
    public void abortRecoverySession(String sessionId, String reason) {
        RecoveryCoordinationSession session = requireActive(sessionId);
        if (!session.transitionTo(CoordinationStatus.ABORTED, clock.instant())) {
            log.debug("[coordination] session={} already {}", sessionId, session.status().code());
            return;
        }
        String why = reason == null ? "unspecified" : reason;
        log.warn("[coordination] aborting session={} reason={}", sessionId, why);
        record(session, event(session, session.initiatorAgentId(), CoordinationEventType.SESSION_ABORTED,
                Map.of("reason", why)));
        notifyAll(session, new AgentNotification("recovery_session_aborted", sessionId, Map.of("reason", why)));
        cleanup(session);
        events.publish(EVENT_SOURCE, "recovery_session_aborted", sessionId, Map.of("reason", why));
    }

    public List<RecoveryCoordinationSession> getActiveSessions() {
        return new ArrayList<>(activeSessions.values());
    }

    public Optional<RecoveryCoordinationSession> getSession(String sessionId) {
        RecoveryCoordinationSession active = activeSessions.get(sessionId);
        if (active != null) {
            return Optional.of(active);
        }
        return Optional.ofNullable(finishedSessions.getIfPresent(sessionId));
    }

    private RecoveryCoordinationSession requireActive(String sessionId) {
        RecoveryCoordinationSession session = activeSessions.get(sessionId);
        if (session == null) {
            throw new CoordinationException("Recovery session not found: " + sessionId);
        }
        return session;
    }

    private List<String> healthyAgents(List<String> candidates) {
        Map<String, CompletableFuture<Boolean>> checks = new LinkedHashMap<>();
        for (String agent : new LinkedHashSet<>(candidates)) {
            try {
                checks.put(agent, transport.checkHealth(agent)
                        .orTimeout(props.getHealthCheckTimeout().toMillis(), TimeUnit.MILLISECONDS));
            } catch (RuntimeException e) {
                log.warn("[coordination] health check failed agent={}: {}", agent, e.toString());
            }
        }
        List<String> healthy = new ArrayList<>();
        checks.forEach((agent, check) -> {
            try {
                if (Boolean.TRUE.equals(check.join())) {
                    healthy.add(agent);
                } else {
                    log.info("[coordination] excluding unhealthy agent={}", agent);
                }
            } catch (CompletionException e) {
                log.warn("[coordination] excluding agent={}: {}", agent,
                        e.getCause() == null ? e.toString() : e.getCause().toString());
            }
        });
        return healthy;
    }

    private void notifyAll(RecoveryCoordinationSession session, AgentNotification notification) {
        for (String agent : session.participatingAgents()) {
            try {
                transport.notify(agent, notification)
                        .orTimeout(props.getNotifyTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .join();
            } catch (RuntimeException e) {
                log.warn("[coordination] failed to notify agent={} type={} session={}: {}",
                        agent, notification.type(), session.sessionId(), e.toString());
            }
        }
    }

    private void record(RecoveryCoordinationSession session, CoordinationEvent event) {
        session.append(event);
        try {
            store.appendCoordinationEvent(CoordinationEventRow.from(event));
        } catch (RuntimeException e) {
            log.warn("[coordination] failed to record event={}: {}", event.eventId(), e.toString());
        }
    }

    private void persist(RecoveryCoordinationSession session) {
        try {
            store.appendCoordinationSession(CoordinationSessionRow.from(session));
        } catch (RuntimeException e) {
            log.warn("[coordination] failed to store session={}: {}", session.sessionId(), e.toString());
        }
    }

    private void cleanup(RecoveryCoordinationSession session) {
        if (activeSessions.remove(session.sessionId(), session)) {
            finishedSessions.put(session.sessionId(), session);
            persist(session);
        }
    }

    private CoordinationEvent event(RecoveryCoordinationSession session,
                                    String agentId,
                                    CoordinationEventType type,
                                    Map<String, String> data) {
        String eventId = session.sessionId() + "_" + type.code();
        if (type == CoordinationEventType.AGENT_JOINED) {
            eventId += "_" + agentId;
        }
        return new CoordinationEvent(eventId, session.sessionId(), clock.instant(), agentId, type,
                null, null, data, CoordinationEvent.Status.COMPLETED);
    }

    private static RecoveryResult withDuration(RecoveryResult r, long durationMs) {
        return new RecoveryResult(r.success(), r.strategyUsed(), r.actionsExecuted(), durationMs, r.errorResolved(),
                r.sideEffects(), r.rollbackRequired(), r.error());
    }
}
