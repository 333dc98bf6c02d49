package com.example.governance.recovery.action;

import com.example.governance.FakeAgentTransport;
import com.example.governance.MutableClock;
import com.example.governance.degradation.DegradationManager;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import com.example.governance.infra.resilience.CircuitState;
import com.example.governance.observability.ReliabilityEvent;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.RecoveryActionParams;
import com.example.governance.recovery.RecoveryActionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class DispatchingRecoveryActionExecutorTest {

    private MutableClock clock;
    private CircuitBreakerRegistry breakers;
    private DegradationManager degradation;
    private FakeAgentTransport transport;
    private final List<ReliabilityEvent> seen = new ArrayList<>();
    private DispatchingRecoveryActionExecutor executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        ReliabilityEventPublisher events = new ReliabilityEventPublisher(clock);
        events.subscribe(seen::add);
        breakers = new CircuitBreakerRegistry(null, clock, events);
        degradation = Mockito.mock(DegradationManager.class);
        transport = new FakeAgentTransport();
        executor = new DispatchingRecoveryActionExecutor(breakers, degradation, transport, events);
    }

    @Test
    void openWithoutCircuitNameTargetsAgentBreaker() {
        executor.executeAndWait(action("open", RecoveryActionType.CIRCUIT_BREAKER_OPEN,
                new RecoveryActionParams.CircuitToggle(null, 30_000L, "agent")), "agent-1");

        assertThat(breakers.find("agent_agent-1")).hasValueSatisfying(b ->
                assertThat(b.currentState()).isEqualTo(CircuitState.OPEN));
    }

    @Test
    void systemWideOpenAndCloseTouchEveryBreaker() {
        breakers.getOrCreate("db");
        breakers.getOrCreate("search");

        executor.executeAndWait(action("open", RecoveryActionType.CIRCUIT_BREAKER_OPEN,
                new RecoveryActionParams.CircuitToggle(null, 0L, "system_wide")), null);
        assertThat(breakers.snapshot()).allSatisfy((name, state) -> assertThat(breakers.find(name).orElseThrow().isOpen()).isTrue());

        executor.executeAndWait(action("close", RecoveryActionType.CIRCUIT_BREAKER_CLOSE,
                new RecoveryActionParams.CircuitToggle(null, 0L, "system_wide")), null);
        assertThat(breakers.find("db").orElseThrow().currentState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breakers.find("search").orElseThrow().currentState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void systemWideOpenLeavesRecoveryGuardsClosedAndUsesRequestedDuration() {
        breakers.getOrCreate("db");
        breakers.getOrCreate("recovery_circuit_breaker_activation");
        breakers.getOrCreate("recovery_agent-5");

        executor.executeAndWait(action("open", RecoveryActionType.CIRCUIT_BREAKER_OPEN,
                new RecoveryActionParams.CircuitToggle(null, 30_000L, "system_wide")), null);

        assertThat(breakers.find("db").orElseThrow().getState().nextAttemptTime())
                .isEqualTo(clock.instant().plusMillis(30_000L));
        assertThat(breakers.find("recovery_circuit_breaker_activation").orElseThrow().currentState())
                .isEqualTo(CircuitState.CLOSED);
        assertThat(breakers.find("recovery_agent-5").orElseThrow().currentState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void systemWideCloseLeavesTrippedRecoveryGuardOpen() {
        breakers.getOrCreate("db").forceOpen();
        breakers.getOrCreate("recovery_agent-5").forceOpen();

        executor.executeAndWait(action("close", RecoveryActionType.CIRCUIT_BREAKER_CLOSE,
                new RecoveryActionParams.CircuitToggle(null, 0L, "system_wide")), null);

        assertThat(breakers.find("db").orElseThrow().currentState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breakers.find("recovery_agent-5").orElseThrow().isOpen()).isTrue();
    }

    @Test
    void closingUnknownBreakerIsNoOp() {
        executor.executeAndWait(action("close", RecoveryActionType.CIRCUIT_BREAKER_CLOSE,
                new RecoveryActionParams.CircuitToggle("missing", 0L, "agent")), "agent-1");

        assertThat(breakers.find("missing")).isEmpty();
    }

    @Test
    void breakerActionWithoutTargetOrNameFails() {
        assertThatThrownBy(() -> executor.executeAndWait(action("open", RecoveryActionType.CIRCUIT_BREAKER_OPEN,
                new RecoveryActionParams.CircuitToggle(null, 0L, "agent")), null))
                .isInstanceOf(ActionExecutionException.class)
                .hasMessageContaining("no circuit name or target agent");
    }

    @Test
    void fallbackWithLevelRaisesDegradation() {
        executor.executeAndWait(action("degrade", RecoveryActionType.FALLBACK_MODE,
                new RecoveryActionParams.FallbackMode("degraded", 2, Map.of())), "agent-1");

        verify(degradation).escalateTo(2, "recovery_action:degrade");
        assertThat(transport.notifications()).isEmpty();
    }

    @Test
    void fallbackWithoutLevelGoesToAgent() {
        executor.executeAndWait(action("cache", RecoveryActionType.FALLBACK_MODE,
                new RecoveryActionParams.FallbackMode("cached", null, Map.of())), "agent-1");

        verify(degradation, never()).escalateTo(anyInt(), anyString());
        assertThat(transport.notifications()).containsExactly("agent-1:recovery_action");
    }

    @Test
    void untargetedRemoteActionIsPublishedLocally() {
        executor.executeAndWait(action("flush", RecoveryActionType.CLEAR_CACHE,
                new RecoveryActionParams.CacheClear(List.of("memory"))), null);

        assertThat(transport.notifications()).isEmpty();
        assertThat(seen).filteredOn(e -> e.type().equals("local_action")).singleElement().satisfies(e -> {
            assertThat(e.key()).isEqualTo("flush");
            assertThat(e.data()).containsEntry("action_type", "clear_cache")
                    .containsEntry("timeout_ms", 5_000L)
                    .containsEntry("cache_types", List.of("memory"));
        });
    }

    @Test
    void executeAndWaitReportsTimeout() {
        RecoveryActionExecutor never = (a, target) -> new CompletableFuture<>();
        RecoveryAction slow = RecoveryAction.of("slow", RecoveryActionType.RESTART_AGENT, "slow", null, 50L);

        assertThatThrownBy(() -> never.executeAndWait(slow, "agent-1"))
                .isInstanceOfSatisfying(ActionExecutionException.class, e -> {
                    assertThat(e.timedOut()).isTrue();
                    assertThat(e.actionId()).isEqualTo("slow");
                });
    }

    private static RecoveryAction action(String id, RecoveryActionType type, RecoveryActionParams params) {
        return RecoveryAction.of(id, type, id, params, 5_000L);
    }
}
