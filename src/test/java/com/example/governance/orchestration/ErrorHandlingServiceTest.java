package com.example.governance.orchestration;

import com.example.governance.MutableClock;
import com.example.governance.coordination.CoordinationException;
import com.example.governance.coordination.CoordinationProperties;
import com.example.governance.coordination.CoordinationStrategy;
import com.example.governance.coordination.RecoveryCoordinationSession;
import com.example.governance.coordination.RecoveryCoordinator;
import com.example.governance.degradation.DegradationManager;
import com.example.governance.error.ErrorClassification;
import com.example.governance.error.ErrorClassifier;
import com.example.governance.error.ErrorContext;
import com.example.governance.error.ErrorSeverity;
import com.example.governance.error.ErrorType;
import com.example.governance.error.ImpactScope;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import com.example.governance.observability.ReliabilityEvent;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.recovery.RecoveryManager;
import com.example.governance.recovery.RecoveryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ErrorHandlingServiceTest {

    private MutableClock clock;
    private RecoveryManager recoveryManager;
    private RecoveryCoordinator coordinator;
    private DegradationManager degradation;
    private CircuitBreakerRegistry breakers;
    private CoordinationProperties coordinationProps;
    private ReliabilityEventPublisher events;
    private final List<ReliabilityEvent> seen = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        recoveryManager = Mockito.mock(RecoveryManager.class);
        coordinator = Mockito.mock(RecoveryCoordinator.class);
        degradation = Mockito.mock(DegradationManager.class);
        when(degradation.maxLevel()).thenReturn(4);
        events = new ReliabilityEventPublisher(clock);
        events.subscribe(seen::add);
        breakers = new CircuitBreakerRegistry(null, clock, events);
        coordinationProps = new CoordinationProperties();
    }

    @Test
    void approachFollowsScopeSeverityAndRetryability() {
        assertThat(ErrorHandlingService.approachFor(c(ErrorType.NETWORK_ERROR, ErrorSeverity.LOW, ImpactScope.SYSTEM_WIDE)))
                .isEqualTo(RecoveryApproach.COORDINATED);
        assertThat(ErrorHandlingService.approachFor(c(ErrorType.DATABASE_ERROR, ErrorSeverity.HIGH, ImpactScope.AGENT_CLUSTER)))
                .isEqualTo(RecoveryApproach.COORDINATED);
        assertThat(ErrorHandlingService.approachFor(
                c(ErrorType.AGENT_COORDINATION_ERROR, ErrorSeverity.CRITICAL, ImpactScope.SINGLE_AGENT)))
                .isEqualTo(RecoveryApproach.COORDINATED);
        assertThat(ErrorHandlingService.approachFor(
                c(ErrorType.VALIDATION_ERROR, ErrorSeverity.LOW, ImpactScope.SINGLE_REQUEST).withRetryable(false)))
                .isEqualTo(RecoveryApproach.DEGRADATION_ONLY);
        assertThat(ErrorHandlingService.approachFor(c(ErrorType.TIMEOUT_ERROR, ErrorSeverity.MEDIUM, ImpactScope.CROSS_SYSTEM)))
                .isEqualTo(RecoveryApproach.SINGLE_AGENT);
    }

    @Test
    void participantsStartWithFailingAgent() {
        coordinationProps.setFleetAgents(List.of("fleet-1", "agent-1", "fleet-2"));
        ErrorHandlingService service = service((e, ctx) -> null);

        assertThat(service.participantsFor(context(), c(ErrorType.SYSTEM_ERROR, ErrorSeverity.HIGH, ImpactScope.SYSTEM_WIDE)))
                .containsExactly("agent-1", "fleet-1", "fleet-2");
        assertThat(service.participantsFor(context(), c(ErrorType.DATABASE_ERROR, ErrorSeverity.HIGH, ImpactScope.AGENT_CLUSTER)))
                .containsExactly("agent-1", "worker-backup");
    }

    @Test
    void singleAgentSuccessRelaxesDegradation() {
        ErrorClassification network = c(ErrorType.NETWORK_ERROR, ErrorSeverity.MEDIUM, ImpactScope.SINGLE_REQUEST);
        when(recoveryManager.executeRecovery(any(), eq(network))).thenReturn(resolved("circuit_breaker_activation"));

        ErrorHandlingResult result = service((e, ctx) -> network).handleError(new IllegalStateException("boom"), context());

        assertThat(result.approach()).isEqualTo(RecoveryApproach.SINGLE_AGENT);
        assertThat(result.success()).isTrue();
        assertThat(result.recoveryResult().strategyUsed()).isEqualTo("circuit_breaker_activation");
        verify(degradation).recoverDegradation();
        assertThat(seen).filteredOn(ev -> ev.source().equals(ErrorHandlingService.EVENT_SOURCE))
                .singleElement()
                .satisfies(ev -> {
                    assertThat(ev.type()).isEqualTo("error_handled");
                    assertThat(ev.data()).containsEntry("approach", "single_agent");
                });
    }

    @Test
    void failingAgentRecoveryOpensAgentBreaker() {
        ErrorClassification network = c(ErrorType.NETWORK_ERROR, ErrorSeverity.MEDIUM, ImpactScope.SINGLE_REQUEST);
        when(recoveryManager.executeRecovery(any(), any()))
                .thenReturn(RecoveryResult.failed("circuit_breaker_activation", "still down", 5L));
        ErrorHandlingService service = service((e, ctx) -> network);

        ErrorHandlingResult first = service.handleError(new IllegalStateException("boom"), context());
        ErrorHandlingResult second = service.handleError(new IllegalStateException("boom"), context());

        assertThat(first.success()).isFalse();
        assertThat(first.recoveryResult().error()).isEqualTo("still down");
        assertThat(second.success()).isFalse();
        assertThat(breakers.find("recovery_agent-1")).hasValueSatisfying(b -> assertThat(b.isOpen()).isTrue());
        verify(recoveryManager, times(1)).executeRecovery(any(), any());
        verify(degradation, never()).recoverDegradation();
    }

    @Test
    void nonRetryableErrorOnlyDegrades() {
        ErrorClassification validation = c(ErrorType.VALIDATION_ERROR, ErrorSeverity.LOW, ImpactScope.SINGLE_AGENT)
                .withRetryable(false);

        ErrorHandlingResult result = service((e, ctx) -> validation).handleError(new IllegalArgumentException("bad"), context());

        assertThat(result.approach()).isEqualTo(RecoveryApproach.DEGRADATION_ONLY);
        assertThat(result.success()).isTrue();
        assertThat(result.recoveryResult().strategyUsed()).isEqualTo(ErrorHandlingService.DEGRADATION_ONLY_STRATEGY);
        assertThat(result.recoveryResult().sideEffects()).containsExactly("System operating in degraded mode");
        verify(degradation).escalateDegradation(argThat(t -> t.metric().equals("error_occurrence")));
        verify(recoveryManager, never()).executeRecovery(any(), any());
    }

    @Test
    void systemWideCriticalErrorIsContainedThenCoordinated() {
        breakers.getOrCreate("search");
        breakers.getOrCreate("recovery_agent-2");
        ErrorClassification outage = c(ErrorType.SYSTEM_ERROR, ErrorSeverity.CRITICAL, ImpactScope.SYSTEM_WIDE)
                .withImmediateAttention(true);
        RecoveryCoordinationSession session = new RecoveryCoordinationSession("s1", context(), List.of("agent-1"),
                CoordinationStrategy.centralized(), null, clock.instant());
        when(coordinator.initiateRecovery(any(), eq(List.of("agent-1")))).thenReturn(session);
        when(coordinator.executeCoordinatedRecovery("s1")).thenReturn(resolved("plan_e1"));

        ErrorHandlingResult result = service((e, ctx) -> outage).handleError(new IllegalStateException("down"), context());

        assertThat(result.approach()).isEqualTo(RecoveryApproach.COORDINATED);
        assertThat(result.success()).isTrue();
        assertThat(breakers.find("search")).hasValueSatisfying(b -> assertThat(b.isOpen()).isTrue());
        assertThat(breakers.find("recovery_agent-2")).hasValueSatisfying(b -> assertThat(b.isOpen()).isFalse());
        verify(degradation).escalateDegradation(argThat(t ->
                t.metric().equals("error_severity") && t.threshold() == ErrorSeverity.CRITICAL.rank()));
        verify(degradation).recoverDegradation();
    }

    @Test
    void classifierFailureTriggersEmergencyFallback() {
        breakers.getOrCreate("search");
        ErrorClassifier broken = (e, ctx) -> {
            throw new IllegalStateException("classifier offline");
        };

        ErrorHandlingResult result = service(broken).handleError(new RuntimeException("x"), context());

        assertThat(result.approach()).isEqualTo(RecoveryApproach.EMERGENCY_FALLBACK);
        assertThat(result.success()).isFalse();
        assertThat(result.classification().severity()).isEqualTo(ErrorSeverity.EMERGENCY);
        assertThat(result.recoveryResult().error()).isEqualTo(ErrorHandlingService.EMERGENCY_MESSAGE);
        verify(degradation).escalateTo(4, "emergency_fallback");
        assertThat(breakers.find("search")).hasValueSatisfying(b -> assertThat(b.isOpen()).isTrue());
        assertThat(seen).extracting(ReliabilityEvent::type).contains("error_handling_failed");
    }

    @Test
    void coordinationFailureKeepsClassification() {
        ErrorClassification cluster = c(ErrorType.DATABASE_ERROR, ErrorSeverity.HIGH, ImpactScope.AGENT_CLUSTER);
        when(coordinator.initiateRecovery(any(), any()))
                .thenThrow(new CoordinationException("No valid participating agents found for error e1"));

        ErrorHandlingResult result = service((e, ctx) -> cluster).handleError(new IllegalStateException("db"), context());

        assertThat(result.approach()).isEqualTo(RecoveryApproach.EMERGENCY_FALLBACK);
        assertThat(result.classification()).isEqualTo(cluster);
    }

    @Test
    void failingEmergencyFallbackIsReported() {
        when(degradation.escalateTo(4, "emergency_fallback")).thenThrow(new IllegalStateException("store offline"));
        ErrorClassifier broken = (e, ctx) -> {
            throw new IllegalStateException("classifier offline");
        };

        ErrorHandlingResult result = service(broken).handleError(new RuntimeException("x"), context());

        assertThat(result.recoveryResult().error()).isEqualTo("Emergency fallback failed: store offline");
    }

    private ErrorHandlingService service(ErrorClassifier classifier) {
        return new ErrorHandlingService(classifier, recoveryManager, coordinator, degradation, breakers,
                coordinationProps, events, clock);
    }

    private static ErrorContext context() {
        return ErrorContext.of("e1", "agent-1", "worker");
    }

    private static ErrorClassification c(ErrorType type, ErrorSeverity severity, ImpactScope scope) {
        return ErrorClassification.of(type, severity, scope);
    }

    private static RecoveryResult resolved(String strategy) {
        return new RecoveryResult(true, strategy, List.of(), 10L, true, List.of(), false, null);
    }
}
