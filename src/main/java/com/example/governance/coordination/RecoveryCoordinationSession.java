package com.example.governance.coordination;

import com.example.governance.error.ErrorContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of one multi-agent recovery. Every accessor and mutator synchronizes on the
 * session itself, so sessions never contend with each other.
 */
public class RecoveryCoordinationSession {

    private final String sessionId;
    private final String initiatorAgentId;
    private final List<String> participatingAgents;
    private final ErrorContext errorContext;
    private final CoordinationStrategy coordinationStrategy;
    private final Instant startedAt;
    private final List<CoordinationEvent> executionLog = new ArrayList<>();

    private CoordinationStatus status = CoordinationStatus.INITIALIZING;
    private RecoveryPlan recoveryPlan;
    private String leaderAgentId;
    private Instant completedAt;

    public RecoveryCoordinationSession(String sessionId,
                                       ErrorContext errorContext,
                                       List<String> participatingAgents,
                                       CoordinationStrategy coordinationStrategy,
                                       RecoveryPlan recoveryPlan,
                                       Instant startedAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.errorContext = Objects.requireNonNull(errorContext, "errorContext");
        this.initiatorAgentId = errorContext.agentId();
        this.participatingAgents = List.copyOf(participatingAgents);
        this.coordinationStrategy = Objects.requireNonNull(coordinationStrategy, "coordinationStrategy");
        this.recoveryPlan = recoveryPlan;
        this.startedAt = startedAt;
    }

    public String sessionId() {
        return sessionId;
    }

    public String initiatorAgentId() {
        return initiatorAgentId;
    }

    public List<String> participatingAgents() {
        return participatingAgents;
    }

    public ErrorContext errorContext() {
        return errorContext;
    }

    public CoordinationStrategy coordinationStrategy() {
        return coordinationStrategy;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized CoordinationStatus status() {
        return status;
    }

    /**
     * Moves forward to {@code next}. Returns false (and leaves the status unchanged) for a
     * backward or post-terminal transition.
     */
    public synchronized boolean transitionTo(CoordinationStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        status = next;
        if (next.isTerminal()) {
            completedAt = at;
        }
        return true;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized RecoveryPlan recoveryPlan() {
        return recoveryPlan;
    }

    public synchronized void replacePlan(RecoveryPlan plan) {
        this.recoveryPlan = plan;
    }

    public synchronized String leaderAgentId() {
        return leaderAgentId;
    }

    public synchronized void assignLeader(String agentId) {
        this.leaderAgentId = agentId;
    }

    public synchronized Instant completedAt() {
        return completedAt;
    }

    public synchronized void append(CoordinationEvent event) {
        executionLog.add(event);
    }

    public synchronized List<CoordinationEvent> executionLog() {
        return List.copyOf(executionLog);
    }

    public synchronized Optional<Instant> lastEventTime() {
        if (executionLog.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(executionLog.get(executionLog.size() - 1).timestamp());
    }

    public boolean isParticipant(String agentId) {
        return participatingAgents.contains(agentId);
    }
}
