package com.example.governance.coordination;

import com.example.governance.recovery.SuccessCriteria;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

public record RecoveryPlan(String planId,
                           List<RecoveryPhase> phases,
                           List<PhaseDependency> dependencies,
                           RollbackPlan rollbackPlan,
                           long estimatedDurationMs,
                           SuccessCriteria successCriteria) {

    public RecoveryPlan {
        phases = phases == null ? List.of() : List.copyOf(phases);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        rollbackPlan = rollbackPlan == null ? new RollbackPlan(List.of(), 0L) : rollbackPlan;
    }

    /**
     * Reduced plan used when consensus is not reached: the first {@code n} phases, with
     * dependencies and rollback phases restricted to them.
     */
    public RecoveryPlan firstPhases(int n) {
        List<RecoveryPhase> kept = phases.subList(0, Math.min(Math.max(n, 0), phases.size()));
        Set<String> ids = kept.stream().map(RecoveryPhase::phaseId).collect(Collectors.toSet());
        List<PhaseDependency> deps = new ArrayList<>();
        for (PhaseDependency d : dependencies) {
            if (ids.contains(d.phaseId())) {
                deps.add(d);
            }
        }
        List<RollbackPhase> rb = rollbackPlan.phases().stream()
                .filter(p -> ids.contains(p.originalPhaseId()))
                .toList();
        long rbTimeout = rb.stream().mapToLong(RollbackPhase::timeoutMs).sum();
        long duration = kept.stream().mapToLong(RecoveryPhase::timeoutMs).sum();
        return new RecoveryPlan(planId + "_fallback", kept, deps, new RollbackPlan(rb, rbTimeout), duration, successCriteria);
    }

    public List<String> phaseIds() {
        return phases.stream().map(RecoveryPhase::phaseId).toList();
    }
}
