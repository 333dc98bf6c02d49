package com.example.governance.error;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a single failure observed by an agent.
 */
public record ErrorContext(String errorId,
                           String agentId,
                           String agentType,
                           Instant timestamp,
                           String stackTrace,
                           String sessionId,
                           String correlationId,
                           EnvironmentSnapshot environment,
                           Map<String, String> metadata) {

    public ErrorContext {
        Objects.requireNonNull(errorId, "errorId");
        Objects.requireNonNull(agentId, "agentId");
        timestamp = timestamp == null ? Instant.now() : timestamp;
        environment = environment == null ? EnvironmentSnapshot.empty() : environment;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ErrorContext of(String errorId, String agentId, String agentType) {
        return new ErrorContext(errorId, agentId, agentType, Instant.now(), null, null, null, null, null);
    }

    public ErrorContext withEnvironment(EnvironmentSnapshot env) {
        return new ErrorContext(errorId, agentId, agentType, timestamp, stackTrace, sessionId, correlationId, env, metadata);
    }

    public ErrorContext withStackTrace(String trace) {
        return new ErrorContext(errorId, agentId, agentType, timestamp, trace, sessionId, correlationId, environment, metadata);
    }

    public boolean stackTraceContains(String needle) {
        return stackTrace != null && needle != null
                && stackTrace.toLowerCase(java.util.Locale.ROOT).contains(needle.toLowerCase(java.util.Locale.ROOT));
    }
}
