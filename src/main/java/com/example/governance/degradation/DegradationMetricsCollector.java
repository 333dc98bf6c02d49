package com.example.governance.degradation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Level-change history. Guarded by the owning {@link DegradationManager}.
 */
public class DegradationMetricsCollector {

    private static final int RECENT_SLICE = 10;

    private final Clock clock;
    private final Duration retention;
    private final Deque<LevelChange> changes = new ArrayDeque<>();
    private Instant lastChangeTime;

    public DegradationMetricsCollector(Clock clock, Duration retention) {
        this.clock = clock;
        this.retention = retention == null ? Duration.ofHours(24) : retention;
    }

    public synchronized void recordLevelChange(int from, int to) {
        Instant now = clock.instant();
        changes.addLast(new LevelChange(now, from, to));
        lastChangeTime = now;
        Instant cutoff = now.minus(retention);
        while (!changes.isEmpty() && !changes.peekFirst().timestamp().isAfter(cutoff)) {
            changes.removeFirst();
        }
    }

    /** {@code Long.MAX_VALUE} when the level has never changed. */
    public synchronized long millisSinceLastChange() {
        if (lastChangeTime == null) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, Duration.between(lastChangeTime, clock.instant()).toMillis());
    }

    public synchronized int changesInLastHour() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(1));
        int n = 0;
        for (LevelChange c : changes) {
            if (c.timestamp().isAfter(cutoff)) {
                n++;
            }
        }
        return n;
    }

    public synchronized DegradationMetrics recentMetrics() {
        List<LevelChange> all = new ArrayList<>(changes);
        List<LevelChange> recent = all.subList(Math.max(0, all.size() - RECENT_SLICE), all.size());
        int escalations = 0;
        for (LevelChange c : recent) {
            if (c.escalation()) {
                escalations++;
            }
        }
        return new DegradationMetrics(all.size(), recent.size(), escalations, recent.size() - escalations,
                lastChangeTime, changesInLastHour());
    }

    public synchronized List<LevelChange> history() {
        return List.copyOf(changes);
    }
}
