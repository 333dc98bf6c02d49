package com.example.governance.degradation;

@FunctionalInterface
public interface SystemMetricsSource {

    SystemHealthMetrics currentMetrics();
}
