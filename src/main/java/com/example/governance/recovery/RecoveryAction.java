package com.example.governance.recovery;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Atomic, side-effecting remediation step.
 *
 * @param dependencies ids of actions in the same phase that must have completed first
 */
public record RecoveryAction(String actionId,
                             RecoveryActionType type,
                             String description,
                             RecoveryActionParams params,
                             long timeoutMs,
                             List<String> dependencies) {

    public RecoveryAction {
        Objects.requireNonNull(actionId, "actionId");
        Objects.requireNonNull(type, "type");
        params = params == null ? new RecoveryActionParams.Generic(Map.of()) : params;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive for action " + actionId);
        }
    }

    public static RecoveryAction of(String actionId, RecoveryActionType type, String description,
                                    RecoveryActionParams params, long timeoutMs) {
        return new RecoveryAction(actionId, type, description, params, timeoutMs, List.of());
    }

    /**
     * Compensating action: breaker open/close and scale up/down invert, shutdowns restart the
     * service, everything else falls back to a generic fallback mode.
     */
    public RecoveryAction toRollback(long rollbackTimeoutMs) {
        RecoveryActionType rollbackType = type.rollbackType();
        RecoveryActionParams rollbackParams = switch (rollbackType) {
            case CIRCUIT_BREAKER_OPEN, CIRCUIT_BREAKER_CLOSE, SCALE_UP, SCALE_DOWN -> params.compensation(actionId);
            case RESTART_SERVICE -> new RecoveryActionParams.Generic(Map.of("original_action", actionId));
            default -> new RecoveryActionParams.FallbackMode("rollback", null, Map.of("original_action", actionId));
        };
        return new RecoveryAction(
                "rollback_" + actionId,
                rollbackType,
                "Rollback: " + (description == null ? actionId : description),
                rollbackParams,
                Math.max(1L, rollbackTimeoutMs),
                List.of());
    }
}
