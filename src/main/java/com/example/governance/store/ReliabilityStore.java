package com.example.governance.store;

/**
 * Append-only persistence for the reliability tables. Writes are best-effort from the caller's
 * point of view: callers log a {@link ReliabilityStoreException} and carry on.
 */
public interface ReliabilityStore {

    void appendRecoveryAttempt(RecoveryAttemptRow row);

    void appendRecoveryStrategy(RecoveryStrategyRow row);

    void appendDegradationEvent(DegradationEventRow row);

    void appendCoordinationEvent(CoordinationEventRow row);

    void appendCoordinationSession(CoordinationSessionRow row);
}
