package com.example.governance.coordination;

import com.example.governance.transport.AgentTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Picks the agent that leads a session. Ties always go to the candidate listed first, so
 * the same inputs elect the same leader.
 */
@Slf4j
public class LeaderElection {

    private final AgentTransport transport;
    private final Duration timeout;

    public LeaderElection(AgentTransport transport, Duration timeout) {
        this.transport = transport;
        this.timeout = timeout;
    }

    public String electLeader(List<String> agents, CoordinationStrategy strategy) {
        if (agents.isEmpty()) {
            throw new CoordinationException("Cannot elect a leader without agents");
        }
        LeaderElectionMethod method = strategy.leaderElectionMethod();
        String leader;
        if (method == null) {
            leader = agents.get(0);
        } else {
            leader = switch (method) {
                case FIXED -> agents.get(0);
                case VOTING -> byVoting(agents);
                case DYNAMIC -> byCapability(agents);
            };
        }
        log.info("[election] leader={} method={} agents={}", leader, method == null ? "initiator" : method.code(), agents.size());
        return leader;
    }

    String byVoting(List<String> agents) {
        Map<String, Integer> tally = new LinkedHashMap<>();
        agents.forEach(a -> tally.put(a, 0));
        Map<String, String> ballots = gather(agents, voter -> transport.castLeaderVote(voter, agents));
        ballots.values().forEach(candidate -> tally.computeIfPresent(candidate, (k, v) -> v + 1));
        String leader = agents.get(0);
        int best = tally.get(leader);
        for (Map.Entry<String, Integer> e : tally.entrySet()) {
            if (e.getValue() > best) {
                best = e.getValue();
                leader = e.getKey();
            }
        }
        return leader;
    }

    String byCapability(List<String> agents) {
        Map<String, Double> scores = gather(agents, transport::capabilityScore);
        String leader = agents.get(0);
        double best = Double.NEGATIVE_INFINITY;
        for (String agent : agents) {
            Double score = scores.get(agent);
            if (score != null && score > best) {
                best = score;
                leader = agent;
            }
        }
        return leader;
    }

    private <T> Map<String, T> gather(List<String> agents, Function<String, CompletableFuture<T>> call) {
        Map<String, CompletableFuture<T>> pending = new LinkedHashMap<>();
        for (String agent : agents) {
            try {
                pending.put(agent, call.apply(agent).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS));
            } catch (RuntimeException e) {
                log.warn("[election] request failed agent={}: {}", agent, e.toString());
            }
        }
        Map<String, T> out = new LinkedHashMap<>();
        pending.forEach((agent, future) -> {
            try {
                T value = future.join();
                if (value != null) {
                    out.put(agent, value);
                }
            } catch (CompletionException e) {
                log.warn("[election] no answer from agent={}: {}", agent,
                        e.getCause() == null ? e.toString() : e.getCause().toString());
            }
        });
        return out;
    }
}
