package com.example.governance.recovery;

import com.example.governance.error.ErrorClassification;
import com.example.governance.error.ErrorContext;
import com.example.governance.infra.resilience.CircuitBreaker;
import com.example.governance.infra.resilience.CircuitBreakerConfig;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import com.example.governance.infra.resilience.OpenCircuitException;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.resilience.SingleFlightManager;
import com.example.governance.store.RecoveryAttemptRow;
import com.example.governance.store.RecoveryStrategyRow;
import com.example.governance.store.ReliabilityStore;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single-agent recovery.
 *
 * <p>Concurrent requests for the same error id share one execution and one result. Each
 * strategy runs behind its own {@code recovery_<strategyId>} breaker; a result that does not
 * resolve the error counts as a breaker failure.</p>
 */
@Slf4j
public class RecoveryManager {

    public static final String EVENT_SOURCE = "recovery";
    public static final String NO_STRATEGY_MESSAGE = "No suitable recovery strategies found";

    private final RecoveryStrategyCatalog catalog;
    private final RecoveryStrategySelector selector;
    private final RecoveryStrategyExecutor strategyExecutor;
    private final CircuitBreakerRegistry breakers;
    private final SingleFlightManager singleFlight;
    private final ReliabilityStore store;
    private final ReliabilityEventPublisher events;
    private final RecoveryProperties props;
    private final Clock clock;

    private final Map<String, RecoveryStrategy> strategies = new ConcurrentHashMap<>();
    private final Cache<String, List<RecoveryAttempt>> history;
    private final CircuitBreakerConfig breakerConfig;

    public RecoveryManager(RecoveryStrategyCatalog catalog,
                           RecoveryStrategySelector selector,
                           RecoveryStrategyExecutor strategyExecutor,
                           CircuitBreakerRegistry breakers,
                           SingleFlightManager singleFlight,
                           ReliabilityStore store,
                           ReliabilityEventPublisher events,
                           RecoveryProperties props,
                           Clock clock) {
        this.catalog = catalog;
        this.selector = selector;
        this.strategyExecutor = strategyExecutor;
        this.breakers = breakers;
        this.singleFlight = singleFlight;
        this.store = store;
        this.events = events;
        this.props = props == null ? new RecoveryProperties() : props;
        this.clock = clock;
        this.history = Caffeine.newBuilder()
                .expireAfterWrite(this.props.getHistoryTtl())
                .maximumSize(10_000)
                .build();
        this.breakerConfig = CircuitBreakerConfig.defaults()
                .withRecoveryTimeout(this.props.getBreakerRecoveryTimeout())
                .withMinimumThroughput(1);
        catalog.defaults().forEach(s -> strategies.put(s.strategyId(), s));
        log.info("[recovery] initialized {} default strategies", strategies.size());
    }

    public RecoveryResult executeRecovery(ErrorContext error, ErrorClassification classification) {
        try {
            return executeRecoveryAsync(error, classification).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("[recovery] recovery could not run error={}: {}", error.errorId(), cause.toString());
            return RecoveryResult.failed(String.valueOf(cause.getMessage()), 0L);
        }
    }

    /**
     * Starts (or joins) the recovery for {@code error.errorId()}.
     */
    public CompletableFuture<RecoveryResult> executeRecoveryAsync(ErrorContext error, ErrorClassification classification) {
        return singleFlight.submit(error.errorId(), () -> recover(error, classification));
    }

    public List<RecoveryStrategy> getAvailableStrategies(ErrorClassification classification) {
        return strategies.values().stream()
                .filter(s -> s.appliesTo(classification))
                .sorted(Comparator.comparingInt(RecoveryStrategy::priority).reversed()
                        .thenComparing(RecoveryStrategy::strategyId))
                .toList();
    }

    public void registerStrategy(RecoveryStrategy strategy) {
        log.info("[recovery] registering strategy id={} types={}", strategy.strategyId(), strategy.applicableErrorTypes());
        strategies.put(strategy.strategyId(), strategy);
        try {
            store.appendRecoveryStrategy(RecoveryStrategyRow.from(strategy));
        } catch (RuntimeException e) {
            log.warn("[recovery] failed to store strategy id={}: {}", strategy.strategyId(), e.toString());
        }
        events.publish(EVENT_SOURCE, "strategy_registered", strategy.strategyId(), Map.of("priority", strategy.priority()));
    }

    public Optional<RecoveryStrategy> getStrategy(String strategyId) {
        return Optional.ofNullable(strategies.get(strategyId));
    }

    /** Most recent attempts for the agent, newest first. */
    public List<RecoveryAttempt> getRecoveryHistory(String agentId) {
        List<RecoveryAttempt> attempts = history.getIfPresent(agentId);
        return attempts == null ? List.of() : List.copyOf(attempts);
    }

    RecoveryResult recover(ErrorContext error, ErrorClassification classification) {
        long start = clock.millis();
        log.info("[recovery] starting error={} agent={} type={} severity={}", error.errorId(), error.agentId(),
                classification.errorType().code(), classification.severity().code());

        List<RecoveryStrategy> candidates = getAvailableStrategies(classification);
        if (candidates.isEmpty()) {
            RecoveryResult result = RecoveryResult.failed(NO_STRATEGY_MESSAGE, clock.millis() - start);
            publishOutcome(error, result);
            return result;
        }
        RecoveryStrategy strategy = selector.selectBestStrategy(candidates, classification);
        RecoveryAttempt attempt = new RecoveryAttempt("attempt_" + UUID.randomUUID(), error.errorId(), error.agentId(),
                strategy.strategyId(), clock.instant(), null, AttemptStatus.EXECUTING, null);
        appendAttempt(attempt);

        RecoveryResult result;
        List<String> unmet = checkPrerequisites(strategy, error);
        if (!unmet.isEmpty()) {
            result = RecoveryResult.failed(strategy.strategyId(), "Prerequisites not met: " + String.join(", ", unmet),
                    clock.millis() - start);
        } else {
            result = runGuarded(strategy, error, classification, attempt.attemptId(), start);
        }

        RecoveryAttempt done = attempt.complete(clock.instant(), result);
        appendAttempt(done);
        remember(done);
        publishOutcome(error, result);
        log.info("[recovery] finished error={} strategy={} success={} duration={}ms",
                error.errorId(), strategy.strategyId(), result.success(), result.durationMs());
        return result;
    }

    private RecoveryResult runGuarded(RecoveryStrategy strategy,
                                      ErrorContext error,
                                      ErrorClassification classification,
                                      String attemptId,
                                      long start) {
        CircuitBreaker breaker = breakers.getOrCreate(CircuitBreakerRegistry.RECOVERY_GUARD_PREFIX + strategy.strategyId(), breakerConfig);
        List<RecoveryAction> actions = catalog.actionsFor(strategy, error, classification);
        try {
            return breaker.call(() -> {
                RecoveryResult r = strategyExecutor.execute(strategy, actions, error,
                        (action, status) -> onActionUpdate(attemptId, action, status));
                if (!r.success()) {
                    throw new UnresolvedRecoveryException(r);
                }
                return r;
            }, error);
        } catch (UnresolvedRecoveryException e) {
            return e.result();
        } catch (OpenCircuitException e) {
            log.warn("[recovery] strategy {} rejected: {}", strategy.strategyId(), e.getMessage());
            return RecoveryResult.failed(strategy.strategyId(), e.getMessage(), clock.millis() - start);
        } catch (Exception e) {
            log.error("[recovery] strategy {} errored: {}", strategy.strategyId(), e.toString(), e);
            return new RecoveryResult(false, strategy.strategyId(), List.of(), clock.millis() - start, false,
                    List.of(String.valueOf(e.getMessage())), true, String.valueOf(e.getMessage()));
        }
    }

    /** Descriptions of the prerequisites that failed, threw or timed out. */
    List<String> checkPrerequisites(RecoveryStrategy strategy, ErrorContext error) {
        List<String> failures = new ArrayList<>();
        for (RecoveryPrerequisite p : strategy.prerequisites()) {
            try {
                Boolean ok = p.validator().apply(error).orTimeout(p.timeoutMs(), TimeUnit.MILLISECONDS).join();
                if (!Boolean.TRUE.equals(ok)) {
                    failures.add(p.description());
                }
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                String why = cause instanceof TimeoutException ? "Timeout" : String.valueOf(cause.getMessage());
                failures.add(p.description() + ": " + why);
            }
        }
        return failures;
    }

    private void onActionUpdate(String attemptId, RecoveryAction action, String status) {
        log.debug("[recovery] action {} id={} attempt={}", status, action.actionId(), attemptId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("attempt_id", attemptId);
        data.put("action_type", action.type().code());
        data.put("status", status);
        events.publish(EVENT_SOURCE, "action_update", action.actionId(), data);
    }

    private void appendAttempt(RecoveryAttempt attempt) {
        try {
            store.appendRecoveryAttempt(RecoveryAttemptRow.from(attempt));
        } catch (RuntimeException e) {
            log.warn("[recovery] failed to record attempt={} status={}: {}",
                    attempt.attemptId(), attempt.status().code(), e.toString());
        }
    }

    private void remember(RecoveryAttempt attempt) {
        int limit = Math.max(1, props.getHistorySize());
        history.asMap().compute(attempt.agentId(), (agent, previous) -> {
            List<RecoveryAttempt> next = new ArrayList<>(limit);
            next.add(attempt);
            if (previous != null) {
                for (RecoveryAttempt a : previous) {
                    if (next.size() >= limit) {
                        break;
                    }
                    next.add(a);
                }
            }
            return List.copyOf(next);
        });
    }

    private void publishOutcome(ErrorContext error, RecoveryResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agent_id", error.agentId());
        data.put("strategy", result.strategyUsed());
        data.put("duration_ms", result.durationMs());
        data.put("error", result.error());
        events.publish(EVENT_SOURCE, result.success() ? "recovery_completed" : "recovery_failed", error.errorId(), data);
    }
}
