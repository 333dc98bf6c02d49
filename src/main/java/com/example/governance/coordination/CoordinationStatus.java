package com.example.governance.coordination;

import java.util.Locale;

/**
 * Session lifecycle: INITIALIZING → PLANNING → EXECUTING → {COMPLETED | FAILED | ABORTED}.
 * Transitions only move forward; terminal states are final.
 */
public enum CoordinationStatus {
    INITIALIZING,
    PLANNING,
    EXECUTING,
    COMPLETED,
    FAILED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ABORTED;
    }

    public boolean canTransitionTo(CoordinationStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (next) {
            case ABORTED, FAILED -> true;
            case COMPLETED -> this == EXECUTING;
            default -> next.ordinal() > ordinal();
        };
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
