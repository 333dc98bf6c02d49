package com.example.governance.coordination;

import java.util.Locale;

public enum CoordinationEventType {
    SESSION_STARTED,
    AGENT_JOINED,
    LEADER_ELECTED,
    CONSENSUS_REACHED,
    CONSENSUS_FAILED,
    PHASE_STARTED,
    PHASE_COMPLETED,
    PHASE_FAILED,
    ACTION_STARTED,
    ACTION_COMPLETED,
    ACTION_FAILED,
    ROLLBACK_STARTED,
    ROLLBACK_COMPLETED,
    SESSION_COMPLETED,
    SESSION_FAILED,
    SESSION_ABORTED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
