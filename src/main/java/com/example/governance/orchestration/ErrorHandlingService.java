package com.example.governance.orchestration;

import com.example.governance.coordination.CoordinationProperties;
import com.example.governance.coordination.RecoveryCoordinationSession;
import com.example.governance.coordination.RecoveryCoordinator;
import com.example.governance.degradation.DegradationManager;
import com.example.governance.degradation.TriggerCondition;
import com.example.governance.degradation.TriggerOperator;
import com.example.governance.error.ErrorClassification;
import com.example.governance.error.ErrorClassifier;
import com.example.governance.error.ErrorContext;
import com.example.governance.error.ErrorSeverity;
import com.example.governance.error.ErrorType;
import com.example.governance.error.ImpactScope;
import com.example.governance.infra.resilience.CircuitBreaker;
import com.example.governance.infra.resilience.CircuitBreakerConfig;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import com.example.governance.infra.resilience.OpenCircuitException;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.RecoveryActionParams;
import com.example.governance.recovery.RecoveryActionType;
import com.example.governance.recovery.RecoveryManager;
import com.example.governance.recovery.RecoveryResult;
import com.example.governance.recovery.UnresolvedRecoveryException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for a raw failure: classifies it, applies immediate containment and routes it
 * to single-agent recovery, coordinated recovery or degradation alone.
 *
 * <p>Never throws. Anything unexpected ends in the emergency fallback, which pushes
 * degradation to the maximum level and opens every breaker.</p>
 */
@Slf4j
public class ErrorHandlingService {

    public static final String EVENT_SOURCE = "error_handling";
    public static final String DEGRADATION_ONLY_STRATEGY = "degradation_only";
    public static final String EMERGENCY_MESSAGE = "Emergency fallback activated";

    private static final CircuitBreakerConfig AGENT_BREAKER = new CircuitBreakerConfig(
            50d, Duration.ofSeconds(60), Duration.ofSeconds(300), 1, 1_000, 5, 3);

    private final ErrorClassifier classifier;
    private final RecoveryManager recoveryManager;
    private final RecoveryCoordinator coordinator;
    private final DegradationManager degradation;
    private final CircuitBreakerRegistry breakers;
    private final CoordinationProperties coordinationProps;
    private final ReliabilityEventPublisher events;
    private final Clock clock;

    public ErrorHandlingService(ErrorClassifier classifier,
                                RecoveryManager recoveryManager,
                                RecoveryCoordinator coordinator,
                                DegradationManager degradation,
                                CircuitBreakerRegistry breakers,
                                CoordinationProperties coordinationProps,
                                ReliabilityEventPublisher events,
                                Clock clock) {
        this.classifier = classifier;
        this.recoveryManager = recoveryManager;
        this.coordinator = coordinator;
        this.degradation = degradation;
        this.breakers = breakers;
        this.coordinationProps = coordinationProps == null ? new CoordinationProperties() : coordinationProps;
        this.events = events;
        this.clock = clock;
    }

    public ErrorHandlingResult handleError(Throwable error, ErrorContext context) {
        long start = clock.millis();
        ErrorClassification classification = null;
        try {
            classification = classifier.classify(error, context);
            log.info("[error-handling] error={} agent={} type={} severity={} scope={}", context.errorId(),
                    context.agentId(), classification.errorType().code(), classification.severity().code(),
                    classification.impactScope().code());

            if (classification.requiresImmediateAttention()) {
                contain(classification);
            }
            RecoveryApproach approach = approachFor(classification);
            RecoveryResult result = switch (approach) {
                case COORDINATED -> coordinated(context, classification);
                case DEGRADATION_ONLY -> degradationOnly(start);
                default -> singleAgent(context, classification, start);
            };
            if (result.success() && classification.severity() != ErrorSeverity.EMERGENCY) {
                relaxDegradation();
            }
            ErrorHandlingResult handled = new ErrorHandlingResult(context.errorId(), classification, approach, result,
                    clock.millis() - start);
            publish(handled);
            return handled;
        } catch (RuntimeException e) {
            log.error("[error-handling] handling failed error={}: {}", context.errorId(), e.toString(), e);
            ErrorClassification emergency = classification != null ? classification
                    : ErrorClassification.of(ErrorType.SYSTEM_ERROR, ErrorSeverity.EMERGENCY, ImpactScope.SYSTEM_WIDE)
                    .withImmediateAttention(true);
            ErrorHandlingResult fallback = new ErrorHandlingResult(context.errorId(), emergency,
                    RecoveryApproach.EMERGENCY_FALLBACK, emergencyFallback(start), clock.millis() - start);
            publish(fallback);
            return fallback;
        }
    }

    static RecoveryApproach approachFor(ErrorClassification c) {
        if (c.impactScope() == ImpactScope.SYSTEM_WIDE || c.impactScope() == ImpactScope.AGENT_CLUSTER) {
            return RecoveryApproach.COORDINATED;
        }
        if (c.severity() == ErrorSeverity.CRITICAL && c.errorType() == ErrorType.AGENT_COORDINATION_ERROR) {
            return RecoveryApproach.COORDINATED;
        }
        if (!c.retryable()) {
            return RecoveryApproach.DEGRADATION_ONLY;
        }
        return RecoveryApproach.SINGLE_AGENT;
    }

    /** Agents asked to take part in a coordinated recovery, failing agent first. */
    List<String> participantsFor(ErrorContext context, ErrorClassification c) {
        Set<String> agents = new LinkedHashSet<>();
        agents.add(context.agentId());
        if (c.impactScope() == ImpactScope.SYSTEM_WIDE && coordinationProps.getFleetAgents() != null) {
            agents.addAll(coordinationProps.getFleetAgents());
        }
        if (c.impactScope() == ImpactScope.AGENT_CLUSTER && context.agentType() != null) {
            agents.add(context.agentType() + "-backup");
        }
        return new ArrayList<>(agents);
    }

    private void contain(ErrorClassification c) {
        if (c.impactScope() == ImpactScope.SYSTEM_WIDE || c.impactScope() == ImpactScope.CROSS_SYSTEM) {
            List<String> opened = breakers.forceOpenResources(null);
            log.warn("[error-handling] opened {} breakers for scope={}", opened.size(), c.impactScope().code());
        }
        if (c.severity().isAtLeast(ErrorSeverity.CRITICAL)) {
            int rank = c.severity().rank();
            degradation.escalateDegradation(
                    new TriggerCondition("error_severity", TriggerOperator.EQ, rank, (double) rank, 60_000L));
        }
    }

    private RecoveryResult singleAgent(ErrorContext context, ErrorClassification classification, long start) {
        CircuitBreaker breaker = breakers.getOrCreate(CircuitBreakerRegistry.RECOVERY_GUARD_PREFIX + context.agentId(), AGENT_BREAKER);
        try {
            return breaker.call(() -> {
                RecoveryResult r = recoveryManager.executeRecovery(context, classification);
                if (!r.success()) {
                    throw new UnresolvedRecoveryException(r);
                }
                return r;
            }, context);
        } catch (UnresolvedRecoveryException e) {
            return e.result();
        } catch (OpenCircuitException e) {
            log.warn("[error-handling] agent {} recovery rejected: {}", context.agentId(), e.getMessage());
            return RecoveryResult.failed(e.getMessage(), clock.millis() - start);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("single-agent recovery failed: " + e.getMessage(), e);
        }
    }

    private RecoveryResult coordinated(ErrorContext context, ErrorClassification classification) {
        List<String> participants = participantsFor(context, classification);
        log.info("[error-handling] coordinated recovery error={} participants={}", context.errorId(), participants);
        RecoveryCoordinationSession session = coordinator.initiateRecovery(context, participants);
        return coordinator.executeCoordinatedRecovery(session.sessionId());
    }

    private RecoveryResult degradationOnly(long start) {
        degradation.escalateDegradation(new TriggerCondition("error_occurrence", TriggerOperator.EQ, 1, 1.0d, 60_000L));
        RecoveryAction action = RecoveryAction.of("graceful_degradation", RecoveryActionType.FALLBACK_MODE,
                "Enable graceful degradation", new RecoveryActionParams.FallbackMode("degraded", null, Map.of()), 10_000L);
        return new RecoveryResult(true, DEGRADATION_ONLY_STRATEGY, List.of(action), clock.millis() - start, false,
                List.of("System operating in degraded mode"), false, null);
    }

    private void relaxDegradation() {
        try {
            degradation.recoverDegradation();
        } catch (RuntimeException e) {
            log.warn("[error-handling] degradation recovery after success failed: {}", e.toString());
        }
    }

    private RecoveryResult emergencyFallback(long start) {
        try {
            degradation.escalateTo(degradation.maxLevel(), "emergency_fallback");
            breakers.forceOpenAll();
            return new RecoveryResult(false, "emergency_fallback", List.of(), clock.millis() - start, false,
                    List.of(EMERGENCY_MESSAGE), false, EMERGENCY_MESSAGE);
        } catch (RuntimeException e) {
            log.error("[error-handling] emergency fallback failed: {}", e.toString(), e);
            return RecoveryResult.failed("Emergency fallback failed: " + e.getMessage(), clock.millis() - start);
        }
    }

    private void publish(ErrorHandlingResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("approach", result.approach().code());
        data.put("severity", result.classification().severity().code());
        data.put("duration_ms", result.durationMs());
        data.put("strategy", result.recoveryResult().strategyUsed());
        events.publish(EVENT_SOURCE, result.success() ? "error_handled" : "error_handling_failed", result.errorId(), data);
    }
}
