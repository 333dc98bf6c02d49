package com.example.governance.degradation;

import java.time.Instant;

/**
 * Summary of recent level changes fed to the adaptive controller.
 *
 * @param recentChanges    size of the last-10 slice
 * @param changesLastHour  level changes within the past hour (anti-flap input)
 */
public record DegradationMetrics(int totalChanges,
                                 int recentChanges,
                                 int escalations,
                                 int recoveries,
                                 Instant lastChangeTime,
                                 int changesLastHour) {
}
