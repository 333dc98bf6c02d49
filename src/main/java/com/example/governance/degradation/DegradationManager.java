package com.example.governance.degradation;

import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.store.DegradationEventRow;
import com.example.governance.store.ReliabilityStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * System-wide staged degradation.
 *
 * <p>The current level is a single pointer; transitions are serialized on this instance.
 * Escalation may jump several levels, automatic recovery always steps down exactly one.</p>
 */
@Slf4j
public class DegradationManager {

    public static final String EVENT_SOURCE = "degradation";

    private final DegradationLevelCatalog catalog;
    private final AdaptiveDegradationController controller;
    private final DegradationMetricsCollector collector;
    private final SystemMetricsSource metricsSource;
    private final ReliabilityStore store;
    private final ReliabilityEventPublisher events;
    private final DegradationProperties props;
    private final Clock clock;
    private final FallbackActivator fallbackActivator;

    private final Map<String, FeatureState> featureStates = new ConcurrentHashMap<>();
    private final Set<String> activeFallbacks = ConcurrentHashMap.newKeySet();
    private volatile DegradationLevel currentLevel;

    public DegradationManager(DegradationLevelCatalog catalog,
                              AdaptiveDegradationController controller,
                              DegradationMetricsCollector collector,
                              SystemMetricsSource metricsSource,
                              ReliabilityStore store,
                              ReliabilityEventPublisher events,
                              DegradationProperties props,
                              Clock clock,
                              FallbackActivator fallbackActivator) {
        this.catalog = catalog;
        this.controller = controller;
        this.collector = collector;
        this.metricsSource = metricsSource;
        this.store = store;
        this.events = events;
        this.props = props == null ? new DegradationProperties() : props;
        this.clock = clock;
        this.fallbackActivator = fallbackActivator;
        this.currentLevel = catalog.base();
    }

    public DegradationLevel getCurrentLevel() {
        return currentLevel;
    }

    public DegradationLevel getLevel(int level) {
        return catalog.level(level);
    }

    public int maxLevel() {
        return catalog.maxLevel();
    }

    /**
     * Escalates according to the adaptive controller. Returns true when the level changed;
     * a recommendation at or below the current level is a no-op.
     */
    public synchronized boolean escalateDegradation(TriggerCondition trigger) {
        DegradationLevel from = currentLevel;
        LevelRecommendation rec = controller.recommendLevel(trigger, from.level(), catalog.maxLevel(),
                collector.recentMetrics());
        if (rec.level() <= from.level()) {
            log.debug("[degradation] no escalation needed current={} target={} metric={}",
                    from.level(), rec.level(), trigger.metric());
            return false;
        }
        log.warn("[degradation] escalating {} -> {} metric={} value={} ({})",
                from.level(), rec.level(), trigger.metric(), trigger.effectiveValue(), rec.reasoning());
        DegradationLevel target = catalog.level(rec.level());
        applyLevel(target);
        record("escalated", target, trigger, rec.reasoning());
        Map<String, Object> data = new HashMap<>();
        data.put("from_level", from.level());
        data.put("to_level", target.level());
        data.put("metric", trigger.metric());
        data.put("threshold", trigger.threshold());
        publish("degradation_escalated", target, data);
        return true;
    }

    /**
     * Moves directly to {@code level} (at least one step above the current level), bypassing the
     * controller. Used by recovery actions and the emergency path.
     */
    public synchronized boolean escalateTo(int level, String reason) {
        int bounded = Math.min(Math.max(level, 0), catalog.maxLevel());
        DegradationLevel from = currentLevel;
        if (bounded <= from.level()) {
            return false;
        }
        log.warn("[degradation] escalating {} -> {} reason={}", from.level(), bounded, reason);
        DegradationLevel target = catalog.level(bounded);
        applyLevel(target);
        TriggerCondition marker = new TriggerCondition("manual", TriggerOperator.GTE, bounded, (double) bounded, 0L);
        record("escalated", target, marker, reason);
        publish("degradation_escalated", target, Map.of(
                "from_level", from.level(),
                "to_level", target.level(),
                "reason", reason == null ? "manual" : reason));
        return true;
    }

    /**
     * Steps down one level when every recovery condition holds. Returns true when the level changed.
     */
    public synchronized boolean recoverDegradation() {
        DegradationLevel from = currentLevel;
        if (from.level() == 0) {
            return false;
        }
        RecoveryCheck check = checkRecoveryConditions();
        if (!check.allowed()) {
            log.debug("[degradation] recovery conditions not met level={} reasons={}", from.level(), check.reasons());
            return false;
        }
        DegradationLevel target = catalog.level(from.level() - 1);
        log.info("[degradation] recovering {} -> {}", from.level(), target.level());
        applyLevel(target);
        record("recovered", target, null, null);
        publish("degradation_recovered", target, Map.of("from_level", from.level(), "to_level", target.level()));
        return true;
    }

    public RecoveryCheck checkRecoveryConditions() {
        List<String> reasons = new ArrayList<>();
        if (collector.millisSinceLastChange() < props.getStabilityPeriod().toMillis()) {
            reasons.add("Insufficient stability period");
        }
        SystemHealthMetrics m = currentMetrics();
        DegradationProperties.Recovery r = props.getRecovery();
        if (m.errorRate() > r.getMaxErrorRate()) {
            reasons.add("Error rate too high");
        }
        if (m.responseTimeMs() > r.getMaxResponseTimeMs()) {
            reasons.add("Response time too high");
        }
        if (m.cpuUsage() > r.getMaxCpuUsage()) {
            reasons.add("CPU usage too high");
        }
        if (m.memoryUsage() > r.getMaxMemoryUsage()) {
            reasons.add("Memory usage too high");
        }
        return new RecoveryCheck(reasons.isEmpty(), reasons);
    }

    /** True unless the feature is tracked and not enabled at the current level. */
    public boolean isFeatureEnabled(String feature) {
        FeatureState state = featureStates.get(feature);
        if (state == null) {
            return true;
        }
        return state.enabled() && currentLevel.enabledFeatures().contains(feature);
    }

    public Map<String, FeatureState> getFeatureStates() {
        return Map.copyOf(featureStates);
    }

    public Set<String> getActiveFallbacks() {
        return Set.copyOf(activeFallbacks);
    }

    /**
     * Fallback strategies (global and current level) whose trigger currently holds, best quality first.
     */
    public List<FallbackStrategy> getAvailableFallbacks(String feature) {
        SystemHealthMetrics m = currentMetrics();
        List<FallbackStrategy> out = new ArrayList<>();
        for (FallbackStrategy s : catalog.globalFallbacks()) {
            if (s.triggered(m)) {
                out.add(s);
            }
        }
        for (FallbackStrategy s : currentLevel.fallbackStrategies()) {
            if (s.triggered(m)) {
                out.add(s);
            }
        }
        out.sort(Comparator.comparingDouble(FallbackStrategy::qualityScore).reversed());
        return out;
    }

    /**
     * One background tick: raise a trigger for every metric over its escalation threshold, then
     * try to recover when degraded.
     */
    public void performAutomaticAssessment() {
        SystemHealthMetrics m = currentMetrics();
        for (TriggerCondition trigger : escalationTriggers(m)) {
            escalateDegradation(trigger);
        }
        if (currentLevel.level() > 0) {
            recoverDegradation();
        }
    }

    List<TriggerCondition> escalationTriggers(SystemHealthMetrics m) {
        DegradationProperties.Escalation e = props.getEscalation();
        List<TriggerCondition> triggers = new ArrayList<>();
        if (m.errorRate() > e.getErrorRate()) {
            triggers.add(TriggerCondition.gt(SystemHealthMetrics.ERROR_RATE, e.getErrorRate(), 60_000L).observed(m.errorRate()));
        }
        if (m.responseTimeMs() > e.getResponseTimeMs()) {
            triggers.add(TriggerCondition.gt(SystemHealthMetrics.RESPONSE_TIME, e.getResponseTimeMs(), 60_000L).observed(m.responseTimeMs()));
        }
        if (m.cpuUsage() > e.getCpuUsage()) {
            triggers.add(TriggerCondition.gt(SystemHealthMetrics.CPU_USAGE, e.getCpuUsage(), 30_000L).observed(m.cpuUsage()));
        }
        if (m.memoryUsage() > e.getMemoryUsage()) {
            triggers.add(TriggerCondition.gt(SystemHealthMetrics.MEMORY_USAGE, e.getMemoryUsage(), 30_000L).observed(m.memoryUsage()));
        }
        return triggers;
    }

    private void applyLevel(DegradationLevel level) {
        DegradationLevel previous = currentLevel;
        currentLevel = level;
        Instant now = clock.instant();

        for (String f : level.enabledFeatures()) {
            featureStates.put(f, new FeatureState(f, true, level.level(), now, false));
        }
        for (String f : level.disabledFeatures()) {
            FeatureState prev = featureStates.get(f);
            featureStates.put(f, new FeatureState(f, false, level.level(), now, prev != null && prev.fallbackActive()));
        }

        publish("performance_limits_updated", level, level.performanceLimits().toAttributes());

        activeFallbacks.clear();
        SystemHealthMetrics m = currentMetrics();
        for (FallbackStrategy s : level.fallbackStrategies()) {
            if (!s.triggered(m)) {
                continue;
            }
            try {
                if (fallbackActivator != null) {
                    fallbackActivator.activate(s);
                }
                activeFallbacks.add(s.strategyId());
                publish("fallback_strategy_activated", level, Map.of(
                        "strategy_id", s.strategyId(),
                        "quality_score", s.qualityScore()));
            } catch (RuntimeException e) {
                log.error("[degradation] failed to activate fallback strategy {}: {}", s.strategyId(), e.toString());
            }
        }

        collector.recordLevelChange(previous.level(), level.level());
        log.info("[degradation] level applied: {} ({})", level.level(), level.name());
    }

    private void record(String eventType, DegradationLevel level, TriggerCondition trigger, String reason) {
        if (store == null) {
            return;
        }
        try {
            DegradationEventRow.TriggerData triggerData = trigger == null ? null
                    : new DegradationEventRow.TriggerData(trigger.metric(), trigger.operator().code(),
                    trigger.threshold(), trigger.observedValue(), trigger.windowSizeMs(), reason);
            store.appendDegradationEvent(new DegradationEventRow(
                    UUID.randomUUID().toString(),
                    eventType,
                    level.level(),
                    level.name(),
                    triggerData,
                    clock.instant()));
        } catch (RuntimeException e) {
            log.warn("[degradation] failed to record degradation event type={} level={}: {}",
                    eventType, level.level(), e.toString());
        }
    }

    private void publish(String type, DegradationLevel level, Map<String, ?> data) {
        if (events == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>(data);
        payload.put("level", level.level());
        payload.put("level_name", level.name());
        events.publish(EVENT_SOURCE, type, String.valueOf(level.level()), payload);
    }

    private SystemHealthMetrics currentMetrics() {
        try {
            SystemHealthMetrics m = metricsSource == null ? null : metricsSource.currentMetrics();
            return m == null ? SystemHealthMetrics.healthy() : m;
        } catch (RuntimeException e) {
            log.warn("[degradation] metrics source failed: {}", e.toString());
            return SystemHealthMetrics.healthy();
        }
    }
}
