package com.example.governance.coordination;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

public record CoordinationEvent(String eventId,
                                String sessionId,
                                Instant timestamp,
                                String agentId,
                                CoordinationEventType type,
                                String phaseId,
                                String actionId,
                                Map<String, String> data,
                                Status status) {

    public CoordinationEvent {
        data = data == null ? Map.of() : Map.copyOf(data);
        status = status == null ? Status.COMPLETED : status;
    }

    public enum Status {
        STARTED,
        COMPLETED,
        FAILED;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
