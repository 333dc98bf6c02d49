package com.example.governance.coordination;

import java.util.List;
import java.util.Optional;

/**
 * Compensating phases, already in reverse order of the original plan.
 */
public record RollbackPlan(List<RollbackPhase> phases, long timeoutMs) {

    public RollbackPlan {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    public Optional<RollbackPhase> forPhase(String originalPhaseId) {
        return phases.stream().filter(p -> p.originalPhaseId().equals(originalPhaseId)).findFirst();
    }
}
