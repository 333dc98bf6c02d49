package com.example.governance.store;

import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.RecoveryAttempt;
import com.example.governance.recovery.RecoveryResult;

import java.time.Instant;
import java.util.List;

/** {@code recovery_attempts} row. One row is appended when an attempt starts and one when it ends. */
public record RecoveryAttemptRow(String attemptId,
                                 String errorId,
                                 String agentId,
                                 String strategyId,
                                 Instant startedAt,
                                 Instant completedAt,
                                 String status,
                                 ResultData resultData) {

    public static RecoveryAttemptRow from(RecoveryAttempt a) {
        return new RecoveryAttemptRow(a.attemptId(), a.errorId(), a.agentId(), a.strategyId(), a.startedAt(),
                a.completedAt(), a.status().code(), a.result() == null ? null : ResultData.from(a.result()));
    }

    public record ResultData(boolean success,
                             boolean errorResolved,
                             boolean rollbackRequired,
                             long durationMs,
                             List<String> actionsExecuted,
                             List<String> sideEffects,
                             String error) {

        public static ResultData from(RecoveryResult r) {
            return new ResultData(r.success(), r.errorResolved(), r.rollbackRequired(), r.durationMs(),
                    r.actionsExecuted().stream().map(RecoveryAction::actionId).toList(),
                    r.sideEffects(), r.error());
        }
    }
}
