package com.example.governance.coordination;

import java.util.List;

public record PlanVote(String agentId, boolean approval, List<String> modifications, double confidence) {

    public PlanVote {
        modifications = modifications == null ? List.of() : List.copyOf(modifications);
    }

    public static PlanVote approve(String agentId) {
        return new PlanVote(agentId, true, List.of(), 1.0d);
    }

    public static PlanVote reject(String agentId) {
        return new PlanVote(agentId, false, List.of(), 1.0d);
    }
}
