package com.example.governance;

import com.example.governance.coordination.PlanVote;
import com.example.governance.coordination.RecoveryPlan;
import com.example.governance.transport.AgentNotification;
import com.example.governance.transport.AgentTransport;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Scriptable transport: every agent is healthy and approving unless told otherwise. */
public final class FakeAgentTransport implements AgentTransport {

    private final Set<String> unhealthy = ConcurrentHashMap.newKeySet();
    private final Set<String> rejecting = ConcurrentHashMap.newKeySet();
    private final Map<String, Double> scores = new ConcurrentHashMap<>();
    private final Map<String, String> ballots = new ConcurrentHashMap<>();
    private final List<String> notifications = new CopyOnWriteArrayList<>();

    public FakeAgentTransport unhealthy(String... agents) {
        unhealthy.addAll(List.of(agents));
        return this;
    }

    public FakeAgentTransport rejecting(String... agents) {
        rejecting.addAll(List.of(agents));
        return this;
    }

    public FakeAgentTransport score(String agent, double score) {
        scores.put(agent, score);
        return this;
    }

    public FakeAgentTransport ballot(String voter, String candidate) {
        ballots.put(voter, candidate);
        return this;
    }

    @Override
    public CompletableFuture<Boolean> checkHealth(String agentId) {
        return CompletableFuture.completedFuture(!unhealthy.contains(agentId));
    }

    @Override
    public CompletableFuture<Void> notify(String agentId, AgentNotification notification) {
        notifications.add(agentId + ":" + notification.type());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<PlanVote> requestPlanVote(String agentId, RecoveryPlan plan) {
        return CompletableFuture.completedFuture(
                rejecting.contains(agentId) ? PlanVote.reject(agentId) : PlanVote.approve(agentId));
    }

    @Override
    public CompletableFuture<String> castLeaderVote(String voterAgentId, List<String> candidates) {
        String choice = ballots.get(voterAgentId);
        return choice != null ? CompletableFuture.completedFuture(choice)
                : AgentTransport.super.castLeaderVote(voterAgentId, candidates);
    }

    @Override
    public CompletableFuture<Double> capabilityScore(String agentId) {
        Double s = scores.get(agentId);
        return s == null ? CompletableFuture.failedFuture(new IllegalStateException("no score for " + agentId))
                : CompletableFuture.completedFuture(s);
    }

    public List<String> notifications() {
        return List.copyOf(notifications);
    }
}
