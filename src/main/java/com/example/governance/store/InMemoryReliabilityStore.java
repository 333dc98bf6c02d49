package com.example.governance.store;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every appended row in memory. Used when JSONL persistence is disabled and in tests.
 */
public class InMemoryReliabilityStore implements ReliabilityStore {

    private final List<RecoveryAttemptRow> attempts = new CopyOnWriteArrayList<>();
    private final List<RecoveryStrategyRow> strategies = new CopyOnWriteArrayList<>();
    private final List<DegradationEventRow> degradationEvents = new CopyOnWriteArrayList<>();
    private final List<CoordinationEventRow> coordinationEvents = new CopyOnWriteArrayList<>();
    private final List<CoordinationSessionRow> sessions = new CopyOnWriteArrayList<>();

    @Override
    public void appendRecoveryAttempt(RecoveryAttemptRow row) {
        attempts.add(row);
    }

    @Override
    public void appendRecoveryStrategy(RecoveryStrategyRow row) {
        strategies.add(row);
    }

    @Override
    public void appendDegradationEvent(DegradationEventRow row) {
        degradationEvents.add(row);
    }

    @Override
    public void appendCoordinationEvent(CoordinationEventRow row) {
        coordinationEvents.add(row);
    }

    @Override
    public void appendCoordinationSession(CoordinationSessionRow row) {
        sessions.add(row);
    }

    public List<RecoveryAttemptRow> attempts() {
        return List.copyOf(attempts);
    }

    public List<RecoveryStrategyRow> strategies() {
        return List.copyOf(strategies);
    }

    public List<DegradationEventRow> degradationEvents() {
        return List.copyOf(degradationEvents);
    }

    public List<CoordinationEventRow> coordinationEvents() {
        return List.copyOf(coordinationEvents);
    }

    public List<CoordinationSessionRow> sessions() {
        return List.copyOf(sessions);
    }
}
