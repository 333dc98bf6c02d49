package com.example.governance.coordination;

import com.example.governance.recovery.RecoveryAction;

import java.util.List;

public record RollbackPhase(String phaseId, String originalPhaseId, List<RecoveryAction> actions, long timeoutMs) {

    public RollbackPhase {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
