package com.example.governance.transport;

import java.util.Map;
import java.util.Objects;

/**
 * Message pushed to an agent.
 *
 * @param type      e.g. {@code recovery_session_created}, {@code recovery_action}
 * @param reference session id, action id or error id the message is about
 */
public record AgentNotification(String type, String reference, Map<String, Object> attributes) {

    public AgentNotification {
        Objects.requireNonNull(type, "type");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static AgentNotification of(String type, String reference) {
        return new AgentNotification(type, reference, Map.of());
    }
}
