package com.example.governance.recovery.action;

import com.example.governance.degradation.DegradationManager;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.RecoveryActionParams;
import com.example.governance.recovery.RecoveryActionType;
import com.example.governance.transport.AgentNotification;
import com.example.governance.transport.AgentTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Routes actions to whoever can carry them out:
 * <ul>
 *     <li>{@code circuit_breaker_open/close} act on the local breaker registry</li>
 *     <li>{@code fallback_mode} with a degradation level raises the system degradation level</li>
 *     <li>everything else is sent to the target agent as a {@code recovery_action} notification</li>
 * </ul>
 * System-wide toggles skip the {@code recovery_} guards, so coordinated stabilization never blocks
 * single-agent recovery. Actions without a target agent that cannot be applied locally are announced as
 * {@code local_action} events for in-process listeners.
 */
@Slf4j
public class DispatchingRecoveryActionExecutor implements RecoveryActionExecutor {

    public static final String EVENT_SOURCE = "recovery_action";
    public static final String NOTIFICATION_TYPE = "recovery_action";

    private final CircuitBreakerRegistry breakers;
    private final DegradationManager degradation;
    private final AgentTransport transport;
    private final ReliabilityEventPublisher events;

    public DispatchingRecoveryActionExecutor(CircuitBreakerRegistry breakers,
                                             DegradationManager degradation,
                                             AgentTransport transport,
                                             ReliabilityEventPublisher events) {
        this.breakers = breakers;
        this.degradation = degradation;
        this.transport = transport;
        this.events = events;
    }

    @Override
    public CompletableFuture<Void> execute(RecoveryAction action, String targetAgentId) {
        log.debug("[action] executing id={} type={} target={}", action.actionId(), action.type().code(), targetAgentId);
        try {
            return switch (action.type()) {
                case CIRCUIT_BREAKER_OPEN -> {
                    openCircuits(action, targetAgentId);
                    yield CompletableFuture.completedFuture(null);
                }
                case CIRCUIT_BREAKER_CLOSE -> {
                    closeCircuits(action, targetAgentId);
                    yield CompletableFuture.completedFuture(null);
                }
                case FALLBACK_MODE -> fallback(action, targetAgentId);
                default -> remote(action, targetAgentId);
            };
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void openCircuits(RecoveryAction action, String targetAgentId) {
        RecoveryActionParams.CircuitToggle toggle = toggle(action, targetAgentId);
        Duration openFor = toggle.openForMs() > 0 ? Duration.ofMillis(toggle.openForMs()) : null;
        if (toggle.systemWide()) {
            List<String> opened = breakers.forceOpenResources(openFor);
            log.warn("[action] opened {} circuit breakers action={} for={}", opened.size(), action.actionId(), openFor);
            return;
        }
        breakers.getOrCreate(toggle.circuitName()).forceOpen(openFor);
    }

    private void closeCircuits(RecoveryAction action, String targetAgentId) {
        RecoveryActionParams.CircuitToggle toggle = toggle(action, targetAgentId);
        if (toggle.systemWide()) {
            List<String> closed = breakers.forceCloseResources();
            log.info("[action] closed {} circuit breakers action={}", closed.size(), action.actionId());
            return;
        }
        breakers.find(toggle.circuitName()).ifPresent(b -> b.forceClose());
    }

    private RecoveryActionParams.CircuitToggle toggle(RecoveryAction action, String targetAgentId) {
        if (action.params() instanceof RecoveryActionParams.CircuitToggle t) {
            if (t.circuitName() == null && !t.systemWide()) {
                return new RecoveryActionParams.CircuitToggle(agentCircuit(targetAgentId, action), t.openForMs(), t.scope());
            }
            return t;
        }
        return new RecoveryActionParams.CircuitToggle(agentCircuit(targetAgentId, action), 0L, "agent");
    }

    private static String agentCircuit(String targetAgentId, RecoveryAction action) {
        if (targetAgentId == null) {
            throw new IllegalArgumentException("no circuit name or target agent for action " + action.actionId());
        }
        return "agent_" + targetAgentId;
    }

    private CompletableFuture<Void> fallback(RecoveryAction action, String targetAgentId) {
        if (action.params() instanceof RecoveryActionParams.FallbackMode fm && fm.degradationLevel() != null) {
            boolean changed = degradation.escalateTo(fm.degradationLevel(), "recovery_action:" + action.actionId());
            log.info("[action] degradation level>={} requested by {} changed={}",
                    fm.degradationLevel(), action.actionId(), changed);
            return CompletableFuture.completedFuture(null);
        }
        return remote(action, targetAgentId);
    }

    private CompletableFuture<Void> remote(RecoveryAction action, String targetAgentId) {
        Map<String, Object> attrs = new LinkedHashMap<>(action.params().toAttributes());
        attrs.put("action_type", action.type().code());
        attrs.put("timeout_ms", action.timeoutMs());
        if (targetAgentId == null) {
            events.publish(EVENT_SOURCE, "local_action", action.actionId(), attrs);
            return CompletableFuture.completedFuture(null);
        }
        return transport.notify(targetAgentId, new AgentNotification(NOTIFICATION_TYPE, action.actionId(), attrs));
    }
}
