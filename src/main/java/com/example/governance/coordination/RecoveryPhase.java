package com.example.governance.coordination;

import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.SuccessCriteria;

import java.util.List;

public record RecoveryPhase(String phaseId,
                            String name,
                            String description,
                            List<String> assignedAgents,
                            List<RecoveryAction> actions,
                            long timeoutMs,
                            SuccessCriteria successCriteria,
                            boolean canRollback) {

    public RecoveryPhase {
        assignedAgents = assignedAgents == null ? List.of() : List.copyOf(assignedAgents);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
