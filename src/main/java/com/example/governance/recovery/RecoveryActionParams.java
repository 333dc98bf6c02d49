package com.example.governance.recovery;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-kind action parameters. Each variant carries only the fields its action needs.
 */
public interface RecoveryActionParams {

    /** Flat view sent to remote agents along with the action. */
    Map<String, Object> toAttributes();

    /**
     * Parameters for the compensating action. Defaults to a generic fallback marker that
     * references the original action.
     */
    default RecoveryActionParams compensation(String originalActionId) {
        return new FallbackMode("rollback", null, Map.of("original_action", originalActionId));
    }

    record AgentRestart(String agentId, String condition) implements RecoveryActionParams {
        @Override
        public Map<String, Object> toAttributes() {
            Map<String, Object> m = new LinkedHashMap<>();
            putIfPresent(m, "agent_id", agentId);
            putIfPresent(m, "condition", condition);
            return m;
        }
    }

    /**
     * @param openForMs how long an opened circuit should stay open (ignored when closing)
     * @param scope     {@code agent} for a single breaker, {@code system_wide} for all known breakers
     */
    record CircuitToggle(String circuitName, long openForMs, String scope) implements RecoveryActionParams {

        public boolean systemWide() {
            return "system_wide".equalsIgnoreCase(scope);
        }

        @Override
        public Map<String, Object> toAttributes() {
            Map<String, Object> m = new LinkedHashMap<>();
            putIfPresent(m, "circuit_name", circuitName);
            m.put("timeout", openForMs);
            putIfPresent(m, "scope", scope);
            return m;
        }

        @Override
        public RecoveryActionParams compensation(String originalActionId) {
            return this;
        }
    }

    record ConnectionReset(String connectionType) implements RecoveryActionParams {
        @Override
        public Map<String, Object> toAttributes() {
            Map<String, Object> m = new LinkedHashMap<>();
            putIfPresent(m, "connection_type", connectionType);
            return m;
        }
    }

    /**
     * @param degradationLevel minimum system degradation level to enforce, or null for none
     */
    record FallbackMode(String mode, Integer degradationLevel, Map<String, String> attributes)
            implements RecoveryActionParams {

        public FallbackMode {
            attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        }

        @Override
        public Map<String, Object> toAttributes() {
            Map<String, Object> m = new LinkedHashMap<>(attributes);
            putIfPresent(m, "mode", mode);
            putIfPresent(m, "degradation_level", degradationLevel);
            return m;
        }
    }

    record CacheClear(List<String> cacheTypes) implements RecoveryActionParams {

        public CacheClear {
            cacheTypes = cacheTypes == null ? List.of() : List.copyOf(cacheTypes);
        }

        @Override
        public Map<String, Object> toAttributes() {
            return Map.of("cache_types", cacheTypes);
        }
    }

    record Scaling(String target, int delta) implements RecoveryActionParams {
        @Override
        public Map<String, Object> toAttributes() {
            Map<String, Object> m = new LinkedHashMap<>();
            putIfPresent(m, "target", target);
            m.put("delta", delta);
            return m;
        }

        @Override
        public RecoveryActionParams compensation(String originalActionId) {
            return new Scaling(target, -delta);
        }
    }

    record Generic(Map<String, String> attributes) implements RecoveryActionParams {

        public Generic {
            attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        }

        @Override
        public Map<String, Object> toAttributes() {
            return new LinkedHashMap<>(attributes);
        }
    }

    private static void putIfPresent(Map<String, Object> m, String k, Object v) {
        if (v != null) {
            m.put(k, v);
        }
    }
}
