package com.example.governance.degradation;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest metrics pushed by an external monitor.
 */
public class SnapshotSystemMetricsSource implements SystemMetricsSource {

    private final AtomicReference<SystemHealthMetrics> latest = new AtomicReference<>(SystemHealthMetrics.healthy());

    @Override
    public SystemHealthMetrics currentMetrics() {
        return latest.get();
    }

    public void update(SystemHealthMetrics metrics) {
        latest.set(metrics == null ? SystemHealthMetrics.healthy() : metrics);
    }
}
