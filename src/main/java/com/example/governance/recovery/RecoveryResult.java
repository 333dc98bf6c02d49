package com.example.governance.recovery;

import java.util.List;

/**
 * Terminal artifact of one recovery attempt (single-agent or coordinated).
 *
 * @param strategyUsed id of the strategy (or plan) that ran, null when none was selected
 * @param error        failure message for unsuccessful results, null on success
 */
public record RecoveryResult(boolean success,
                             String strategyUsed,
                             List<RecoveryAction> actionsExecuted,
                             long durationMs,
                             boolean errorResolved,
                             List<String> sideEffects,
                             boolean rollbackRequired,
                             String error) {

    public RecoveryResult {
        actionsExecuted = actionsExecuted == null ? List.of() : List.copyOf(actionsExecuted);
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }

    /** Failure before any action ran. */
    public static RecoveryResult failed(String message, long durationMs) {
        return new RecoveryResult(false, null, List.of(), durationMs, false, List.of(message), false, message);
    }

    public static RecoveryResult failed(String strategyUsed, String message, long durationMs) {
        return new RecoveryResult(false, strategyUsed, List.of(), durationMs, false, List.of(message), false, message);
    }
}
