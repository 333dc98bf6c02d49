package com.example.governance.store;

import com.example.governance.coordination.CoordinationEvent;

import java.time.Instant;
import java.util.Map;

/** {@code coordination_events} row. */
public record CoordinationEventRow(String eventId,
                                   String sessionId,
                                   Instant timestamp,
                                   String agentId,
                                   String eventType,
                                   String phaseId,
                                   String actionId,
                                   Map<String, String> eventData,
                                   String status) {

    public static CoordinationEventRow from(CoordinationEvent e) {
        return new CoordinationEventRow(e.eventId(), e.sessionId(), e.timestamp(), e.agentId(), e.type().code(),
                e.phaseId(), e.actionId(), e.data(), e.status().code());
    }
}
