package com.example.governance.degradation;

import com.example.governance.recovery.RecoveryAction;
import com.example.governance.recovery.RecoveryActionParams;
import com.example.governance.recovery.RecoveryActionType;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static com.example.governance.degradation.Features.*;

/**
 * Static level catalog (0 Full Service … 4 Emergency Mode) plus the level-independent
 * fallback strategies.
 */
public final class DegradationLevelCatalog {

    private static final long MB = 1024L * 1024L;

    private final NavigableMap<Integer, DegradationLevel> levels;
    private final List<FallbackStrategy> globalFallbacks;

    public DegradationLevelCatalog(List<DegradationLevel> levels, List<FallbackStrategy> globalFallbacks) {
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("at least one degradation level is required");
        }
        TreeMap<Integer, DegradationLevel> m = new TreeMap<>();
        for (DegradationLevel l : levels) {
            m.put(l.level(), l);
        }
        if (m.firstKey() != 0 || m.lastKey() != m.size() - 1) {
            throw new IllegalArgumentException("degradation levels must be contiguous from 0: " + m.keySet());
        }
        this.levels = m;
        this.globalFallbacks = globalFallbacks == null ? List.of() : List.copyOf(globalFallbacks);
    }

    public static DegradationLevelCatalog defaults() {
        List<DegradationLevel> levels = new ArrayList<>();
        levels.add(new DegradationLevel(0, "Full Service", "All features enabled, full performance",
                features(ALL), Set.of(),
                new PerformanceLimits(1000, 50 * MB, 30_000L, 6000),
                List.of()));
        levels.add(new DegradationLevel(1, "Minor Degradation",
                "Non-essential features disabled, slight performance reduction",
                features(List.of(ADVANCED_ANALYTICS, REAL_TIME_PROCESSING, COMPLEX_QUERIES, NOTIFICATIONS, REPORTING, FILE_UPLOADS)),
                features(List.of(BACKGROUND_JOBS, DATA_EXPORT)),
                new PerformanceLimits(800, 25 * MB, 20_000L, 4800),
                List.of(levelFallback("disable_background_jobs", "Disable Background Jobs",
                        "Suspend non-critical background processing",
                        TriggerCondition.gt(SystemHealthMetrics.CPU_USAGE, 80, 60_000L),
                        "suspend_background_jobs", "Suspend background job processing",
                        Map.of("mode", "suspend_background"), 5_000L, 0.9d, 0.1d))));
        levels.add(new DegradationLevel(2, "Moderate Degradation",
                "Advanced features disabled, performance constraints applied",
                features(List.of(REAL_TIME_PROCESSING, NOTIFICATIONS, REPORTING)),
                features(List.of(ADVANCED_ANALYTICS, COMPLEX_QUERIES, BACKGROUND_JOBS, DATA_EXPORT, FILE_UPLOADS)),
                new PerformanceLimits(500, 10 * MB, 15_000L, 3000),
                List.of(levelFallback("simple_queries_only", "Simple Queries Only",
                        "Restrict to simple database queries only",
                        TriggerCondition.gt(SystemHealthMetrics.RESPONSE_TIME, 5000, 120_000L),
                        "enable_simple_query_mode", "Enable simple query mode",
                        Map.of("query_complexity", "simple"), 3_000L, 0.7d, 0.3d))));
        levels.add(new DegradationLevel(3, "Severe Degradation",
                "Only core features available, significant performance limits",
                features(List.of(NOTIFICATIONS)),
                features(List.of(ADVANCED_ANALYTICS, REAL_TIME_PROCESSING, COMPLEX_QUERIES, BACKGROUND_JOBS, REPORTING, DATA_EXPORT, FILE_UPLOADS)),
                new PerformanceLimits(200, MB, 10_000L, 1200),
                List.of(levelFallback("read_only_mode", "Read-Only Mode", "Allow only read operations",
                        TriggerCondition.gt(SystemHealthMetrics.ERROR_RATE, 0.2, 180_000L),
                        "enable_read_only_mode", "Enable read-only mode",
                        Map.of("mode", "read_only"), 2_000L, 0.5d, 0.6d))));
        levels.add(new DegradationLevel(4, "Emergency Mode", "Minimal functionality, survival mode",
                Set.of(), features(ALL),
                new PerformanceLimits(50, 256L * 1024L, 5_000L, 300),
                List.of(levelFallback("static_response_mode", "Static Response Mode",
                        "Return cached/static responses only",
                        TriggerCondition.gt(SystemHealthMetrics.CPU_USAGE, 95, 60_000L),
                        "enable_static_mode", "Enable static response mode",
                        Map.of("mode", "static_only"), 1_000L, 0.2d, 0.9d))));

        List<FallbackStrategy> global = List.of(
                new FallbackStrategy("cache_fallback", "Cache Fallback",
                        "Serve cached responses when database is unavailable",
                        List.of(TriggerCondition.gt("database_error_rate", 0.5, 30_000L)),
                        RecoveryAction.of("enable_cache_fallback", RecoveryActionType.FALLBACK_MODE,
                                "Enable cache-only mode",
                                new RecoveryActionParams.FallbackMode("cache_only", null, Map.of("cache_type", "redis", "ttl", "300")),
                                2_000L),
                        0.8d, 0.2d),
                new FallbackStrategy("circuit_breaker_fallback", "Circuit Breaker Fallback",
                        "Open circuit breakers to prevent cascade failures",
                        List.of(TriggerCondition.gt("downstream_error_rate", 0.3, 60_000L)),
                        RecoveryAction.of("activate_circuit_breakers", RecoveryActionType.CIRCUIT_BREAKER_OPEN,
                                "Open circuit breakers for failing services",
                                new RecoveryActionParams.CircuitToggle(null, 30_000L, "system_wide"),
                                5_000L),
                        0.9d, 0.1d));
        return new DegradationLevelCatalog(levels, global);
    }

    private static FallbackStrategy levelFallback(String id, String name, String description, TriggerCondition trigger,
                                                  String actionId, String actionDescription, Map<String, String> attrs,
                                                  long actionTimeoutMs, double quality, double impact) {
        RecoveryAction action = RecoveryAction.of(actionId, RecoveryActionType.FALLBACK_MODE, actionDescription,
                new RecoveryActionParams.FallbackMode(attrs.getOrDefault("mode", id), null, attrs), actionTimeoutMs);
        return new FallbackStrategy(id, name, description, List.of(trigger), action, quality, impact);
    }

    private static Set<String> features(List<String> names) {
        return new LinkedHashSet<>(names);
    }

    public DegradationLevel level(int level) {
        DegradationLevel l = levels.get(level);
        if (l == null) {
            throw new IllegalArgumentException("Invalid degradation level: " + level);
        }
        return l;
    }

    public Optional<DegradationLevel> find(int level) {
        return Optional.ofNullable(levels.get(level));
    }

    public DegradationLevel base() {
        return levels.firstEntry().getValue();
    }

    public int maxLevel() {
        return levels.lastKey();
    }

    public List<DegradationLevel> levels() {
        return List.copyOf(levels.values());
    }

    public List<FallbackStrategy> globalFallbacks() {
        return globalFallbacks;
    }
}
