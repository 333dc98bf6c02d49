package com.example.governance.transport;

import com.example.governance.coordination.PlanVote;
import com.example.governance.coordination.RecoveryPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link AgentTransport} over the agent gateway's HTTP API.
 *
 * <ul>
 *     <li>{@code GET  /agents/{id}/health}: any 2xx is healthy</li>
 *     <li>{@code POST /agents/{id}/notifications}</li>
 *     <li>{@code POST /agents/{id}/plan-votes}: returns a {@link PlanVote}</li>
 *     <li>{@code POST /agents/{id}/leader-votes}: returns {@code {"candidate": "..."}}</li>
 *     <li>{@code GET  /agents/{id}/capability}: returns {@code {"score": 0.0-1.0}}</li>
 * </ul>
 */
@Slf4j
public class HttpAgentTransport implements AgentTransport {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpAgentTransport(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
    }

    @Override
    public CompletableFuture<Boolean> checkHealth(String agentId) {
        return webClient.get()
                .uri("/agents/{id}/health", agentId)
                .retrieve()
                .toBodilessEntity()
                .map(r -> r.getStatusCode().is2xxSuccessful())
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.debug("[transport] health check failed agent={}: {}", agentId, e.toString());
                    return Mono.just(false);
                })
                .defaultIfEmpty(false)
                .toFuture();
    }

    @Override
    public CompletableFuture<Void> notify(String agentId, AgentNotification notification) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", notification.type());
        body.put("reference", notification.reference());
        body.put("attributes", notification.attributes());
        return webClient.post()
                .uri("/agents/{id}/notifications", agentId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .then()
                .toFuture();
    }

    @Override
    public CompletableFuture<PlanVote> requestPlanVote(String agentId, RecoveryPlan plan) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("plan_id", plan.planId());
        body.put("phases", plan.phaseIds());
        body.put("estimated_duration_ms", plan.estimatedDurationMs());
        return webClient.post()
                .uri("/agents/{id}/plan-votes", agentId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(PlanVote.class)
                .map(v -> v.agentId() == null ? new PlanVote(agentId, v.approval(), v.modifications(), v.confidence()) : v)
                .timeout(timeout)
                .toFuture();
    }

    @Override
    public CompletableFuture<String> castLeaderVote(String voterAgentId, List<String> candidates) {
        return webClient.post()
                .uri("/agents/{id}/leader-votes", voterAgentId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("candidates", candidates))
                .retrieve()
                .bodyToMono(LeaderBallot.class)
                .map(LeaderBallot::candidate)
                .timeout(timeout)
                .toFuture();
    }

    @Override
    public CompletableFuture<Double> capabilityScore(String agentId) {
        return webClient.get()
                .uri("/agents/{id}/capability", agentId)
                .retrieve()
                .bodyToMono(CapabilityReport.class)
                .map(CapabilityReport::score)
                .timeout(timeout)
                .toFuture();
    }

    record LeaderBallot(String candidate) {
    }

    record CapabilityReport(double score) {
    }
}
