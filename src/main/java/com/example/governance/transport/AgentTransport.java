package com.example.governance.transport;

import com.example.governance.coordination.PlanVote;
import com.example.governance.coordination.RecoveryPlan;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Agent-facing calls. Every call is asynchronous; callers race it against their own timeout.
 *
 * <p>The voting and capability calls have deterministic defaults (approve, first candidate,
 * neutral score) for transports that do not support them.</p>
 */
public interface AgentTransport {

    CompletableFuture<Boolean> checkHealth(String agentId);

    CompletableFuture<Void> notify(String agentId, AgentNotification notification);

    default CompletableFuture<PlanVote> requestPlanVote(String agentId, RecoveryPlan plan) {
        return CompletableFuture.completedFuture(PlanVote.approve(agentId));
    }

    default CompletableFuture<String> castLeaderVote(String voterAgentId, List<String> candidates) {
        return CompletableFuture.completedFuture(candidates.isEmpty() ? voterAgentId : candidates.get(0));
    }

    default CompletableFuture<Double> capabilityScore(String agentId) {
        return CompletableFuture.completedFuture(0.5d);
    }
}
