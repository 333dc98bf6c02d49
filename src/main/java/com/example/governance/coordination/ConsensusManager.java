package com.example.governance.coordination;

import com.example.governance.transport.AgentTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

/**
 * Collects plan votes from the participants. Missing, failed or late votes are dropped.
 * Approvals at or above the threshold keep the plan; otherwise the plan is cut down to its
 * first two phases.
 */
@Slf4j
public class ConsensusManager {

    static final int FALLBACK_PHASES = 2;

    private final AgentTransport transport;
    private final Duration voteTimeout;
    private final double consensusRatio;

    public ConsensusManager(AgentTransport transport, Duration voteTimeout, double consensusRatio) {
        this.transport = transport;
        this.voteTimeout = voteTimeout;
        this.consensusRatio = consensusRatio;
    }

    public Outcome reachConsensus(RecoveryPlan plan, List<String> agents, CoordinationStrategy strategy) {
        List<PlanVote> votes = collectVotes(plan, agents);
        long approvals = votes.stream().filter(PlanVote::approval).count();
        int threshold = strategy.decisionThreshold() != null
                ? strategy.decisionThreshold()
                : (int) Math.ceil(votes.size() * consensusRatio);
        if (approvals >= threshold) {
            log.info("[consensus] reached plan={} approvals={}/{} threshold={}",
                    plan.planId(), approvals, votes.size(), threshold);
            return new Outcome(plan, true, (int) approvals, votes.size(), threshold);
        }
        RecoveryPlan fallback = plan.firstPhases(FALLBACK_PHASES);
        log.warn("[consensus] not reached plan={} approvals={}/{} threshold={}, using {}",
                plan.planId(), approvals, votes.size(), threshold, fallback.planId());
        return new Outcome(fallback, false, (int) approvals, votes.size(), threshold);
    }

    List<PlanVote> collectVotes(RecoveryPlan plan, List<String> agents) {
        Map<String, CompletableFuture<PlanVote>> pending = new LinkedHashMap<>();
        for (String agentId : agents) {
            try {
                pending.put(agentId, transport.requestPlanVote(agentId, plan)
                        .orTimeout(voteTimeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (RuntimeException e) {
                log.warn("[consensus] vote request failed agent={}: {}", agentId, e.toString());
            }
        }
        List<PlanVote> votes = new ArrayList<>();
        pending.forEach((agentId, future) -> {
            try {
                PlanVote vote = future.join();
                if (vote != null) {
                    votes.add(vote);
                }
            } catch (CompletionException e) {
                log.warn("[consensus] dropped vote agent={}: {}", agentId,
                        e.getCause() == null ? e.toString() : e.getCause().toString());
            }
        });
        return votes;
    }

    /**
     * @param plan    the plan to execute: the original one, or its reduced form
     * @param reached whether approvals met the threshold
     */
    public record Outcome(RecoveryPlan plan, boolean reached, int approvals, int votesCast, int threshold) {
    }
}
