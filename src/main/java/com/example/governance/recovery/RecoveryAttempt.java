package com.example.governance.recovery;

import java.time.Instant;

public record RecoveryAttempt(String attemptId,
                              String errorId,
                              String agentId,
                              String strategyId,
                              Instant startedAt,
                              Instant completedAt,
                              AttemptStatus status,
                              RecoveryResult result) {

    public RecoveryAttempt complete(Instant at, RecoveryResult r) {
        AttemptStatus s = r != null && r.success() ? AttemptStatus.COMPLETED : AttemptStatus.FAILED;
        return new RecoveryAttempt(attemptId, errorId, agentId, strategyId, startedAt, at, s, r);
    }
}
