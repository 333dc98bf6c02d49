package com.example.governance.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Advisory notification emitted by the breaker, recovery, degradation and coordination layers.
 *
 * @param source component family, e.g. {@code circuit_breaker}, {@code recovery}
 * @param type   event name, e.g. {@code opened}, {@code recovery_completed}
 * @param key    breaker name, error id, session id or level (may be null)
 * @param data   free-form payload, never null
 */
public record ReliabilityEvent(String source,
                               String type,
                               String key,
                               Instant timestamp,
                               Map<String, Object> data) {

    public ReliabilityEvent {
        timestamp = timestamp == null ? Instant.now() : timestamp;
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
