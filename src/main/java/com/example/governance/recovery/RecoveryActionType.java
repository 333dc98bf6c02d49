package com.example.governance.recovery;

import java.util.Locale;

public enum RecoveryActionType {
    RESTART_AGENT,
    RESTART_SERVICE,
    CLEAR_CACHE,
    RESET_CONNECTIONS,
    FALLBACK_MODE,
    LOAD_BALANCER_REDIRECT,
    CIRCUIT_BREAKER_OPEN,
    CIRCUIT_BREAKER_CLOSE,
    SCALE_UP,
    SCALE_DOWN,
    DATA_REPAIR,
    CONFIGURATION_RELOAD,
    MANUAL_INTERVENTION_REQUIRED,
    GRACEFUL_SHUTDOWN,
    EMERGENCY_STOP;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Compensating action type used when a rollback plan mirrors this action. */
    public RecoveryActionType rollbackType() {
        return switch (this) {
            case CIRCUIT_BREAKER_OPEN -> CIRCUIT_BREAKER_CLOSE;
            case CIRCUIT_BREAKER_CLOSE -> CIRCUIT_BREAKER_OPEN;
            case SCALE_UP -> SCALE_DOWN;
            case SCALE_DOWN -> SCALE_UP;
            case GRACEFUL_SHUTDOWN, EMERGENCY_STOP -> RESTART_SERVICE;
            default -> FALLBACK_MODE;
        };
    }
}
