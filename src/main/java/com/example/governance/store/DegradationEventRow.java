package com.example.governance.store;

import java.time.Instant;

/** {@code degradation_events} row. {@code triggerData} is null for recoveries. */
public record DegradationEventRow(String eventId,
                                  String eventType,
                                  int degradationLevel,
                                  String levelName,
                                  TriggerData triggerData,
                                  Instant createdAt) {

    public record TriggerData(String metric,
                              String operator,
                              double threshold,
                              Double observedValue,
                              long windowSizeMs,
                              String reason) {
    }
}
