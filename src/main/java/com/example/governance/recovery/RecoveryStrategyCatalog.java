package com.example.governance.recovery;

import com.example.governance.error.ErrorClassification;
import com.example.governance.error.ErrorContext;
import com.example.governance.error.ErrorSeverity;
import com.example.governance.error.ErrorType;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Built-in strategies and the actions each one generates.
 */
public class RecoveryStrategyCatalog {

    public static final String AGENT_RESTART = "agent_restart";
    public static final String CIRCUIT_BREAKER_ACTIVATION = "circuit_breaker_activation";
    public static final String DB_CONNECTION_RESET = "db_connection_reset";
    public static final String GRACEFUL_DEGRADATION = "graceful_degradation";
    public static final String CACHE_CLEAR = "cache_clear";

    private final int maxDegradationLevel;

    public RecoveryStrategyCatalog(int maxDegradationLevel) {
        this.maxDegradationLevel = maxDegradationLevel;
    }

    public List<RecoveryStrategy> defaults() {
        return List.of(
                RecoveryStrategy.builder()
                        .strategyId(AGENT_RESTART)
                        .name("Agent Restart")
                        .description("Restart the failing agent process")
                        .applicableErrorTypes(EnumSet.of(ErrorType.SYSTEM_ERROR, ErrorType.RESOURCE_EXHAUSTION,
                                ErrorType.AGENT_COORDINATION_ERROR))
                        .applicableSeverities(EnumSet.of(ErrorSeverity.MEDIUM, ErrorSeverity.HIGH, ErrorSeverity.CRITICAL))
                        .priority(80)
                        .maxAttempts(3)
                        .timeoutMs(120_000L)
                        .successCriteria(new SuccessCriteria(true, 5_000L, 0.1d, 0.9d, List.of()))
                        .estimatedRecoveryTimeMs(60_000L)
                        .build(),
                RecoveryStrategy.builder()
                        .strategyId(CIRCUIT_BREAKER_ACTIVATION)
                        .name("Circuit Breaker Activation")
                        .description("Activate circuit breaker to prevent cascade failures")
                        .applicableErrorTypes(EnumSet.of(ErrorType.NETWORK_ERROR, ErrorType.TIMEOUT_ERROR,
                                ErrorType.DEPENDENCY_ERROR))
                        .applicableSeverities(EnumSet.of(ErrorSeverity.MEDIUM, ErrorSeverity.HIGH))
                        .priority(90)
                        .maxAttempts(1)
                        .timeoutMs(5_000L)
                        .successCriteria(new SuccessCriteria(false, 1_000L, 0.0d, 1.0d, List.of()))
                        .estimatedRecoveryTimeMs(5_000L)
                        .build(),
                RecoveryStrategy.builder()
                        .strategyId(DB_CONNECTION_RESET)
                        .name("Database Connection Reset")
                        .description("Reset database connection pool")
                        .applicableErrorTypes(EnumSet.of(ErrorType.DATABASE_ERROR))
                        .applicableSeverities(EnumSet.of(ErrorSeverity.MEDIUM, ErrorSeverity.HIGH))
                        .priority(70)
                        .maxAttempts(2)
                        .timeoutMs(30_000L)
                        .successCriteria(new SuccessCriteria(true, 3_000L, 0.05d, 0.95d, List.of()))
                        .estimatedRecoveryTimeMs(15_000L)
                        .build(),
                RecoveryStrategy.builder()
                        .strategyId(GRACEFUL_DEGRADATION)
                        .name("Graceful Degradation")
                        .description("Enable degraded mode with reduced functionality")
                        .applicableErrorTypes(EnumSet.of(ErrorType.RESOURCE_EXHAUSTION, ErrorType.DEPENDENCY_ERROR,
                                ErrorType.SYSTEM_ERROR))
                        .applicableSeverities(EnumSet.of(ErrorSeverity.MEDIUM, ErrorSeverity.HIGH, ErrorSeverity.CRITICAL))
                        .priority(60)
                        .maxAttempts(1)
                        .timeoutMs(10_000L)
                        .successCriteria(new SuccessCriteria(true, 10_000L, 0.2d, 0.8d, List.of()))
                        .estimatedRecoveryTimeMs(5_000L)
                        .build(),
                RecoveryStrategy.builder()
                        .strategyId(CACHE_CLEAR)
                        .name("Cache Clear")
                        .description("Clear application caches to resolve data inconsistencies")
                        .applicableErrorTypes(EnumSet.of(ErrorType.DATA_CORRUPTION_ERROR, ErrorType.BUSINESS_LOGIC_ERROR))
                        .applicableSeverities(EnumSet.of(ErrorSeverity.LOW, ErrorSeverity.MEDIUM))
                        .priority(50)
                        .maxAttempts(1)
                        .timeoutMs(15_000L)
                        .successCriteria(new SuccessCriteria(true, 5_000L, 0.1d, 0.9d, List.of()))
                        .estimatedRecoveryTimeMs(10_000L)
                        .build());
    }

    /**
     * Actions for {@code strategy}: its own list when it carries one, otherwise the built-in
     * actions for its id. Unknown ids without actions produce an empty list.
     */
    public List<RecoveryAction> actionsFor(RecoveryStrategy strategy, ErrorContext error, ErrorClassification classification) {
        if (!strategy.actions().isEmpty()) {
            return strategy.actions();
        }
        return switch (strategy.strategyId()) {
            case AGENT_RESTART -> List.of(RecoveryAction.of("restart_agent_process", RecoveryActionType.RESTART_AGENT,
                    "Restart the agent process",
                    new RecoveryActionParams.AgentRestart(error.agentId(), null), 60_000L));
            case CIRCUIT_BREAKER_ACTIVATION -> List.of(RecoveryAction.of("open_circuit_breaker",
                    RecoveryActionType.CIRCUIT_BREAKER_OPEN,
                    "Open circuit breaker to prevent cascade failures",
                    new RecoveryActionParams.CircuitToggle("agent_" + error.agentId(), 30_000L, "agent"), 5_000L));
            case DB_CONNECTION_RESET -> List.of(RecoveryAction.of("reset_db_connections", RecoveryActionType.RESET_CONNECTIONS,
                    "Reset database connection pool",
                    new RecoveryActionParams.ConnectionReset("database"), 30_000L));
            case GRACEFUL_DEGRADATION -> List.of(RecoveryAction.of("enable_degraded_mode", RecoveryActionType.FALLBACK_MODE,
                    "Enable graceful degradation mode",
                    new RecoveryActionParams.FallbackMode("degraded", degradationLevelFor(classification.severity()), Map.of()),
                    10_000L));
            case CACHE_CLEAR -> List.of(RecoveryAction.of("clear_application_cache", RecoveryActionType.CLEAR_CACHE,
                    "Clear application caches",
                    new RecoveryActionParams.CacheClear(List.of("memory", "redis")), 15_000L));
            default -> List.of();
        };
    }

    /** low 1, medium 2, high 3, critical and emergency 4; never above the deepest level. */
    int degradationLevelFor(ErrorSeverity severity) {
        int level = switch (severity) {
            case LOW -> 1;
            case MEDIUM -> 2;
            case HIGH -> 3;
            case CRITICAL, EMERGENCY -> 4;
        };
        return Math.min(level, maxDegradationLevel);
    }
}
