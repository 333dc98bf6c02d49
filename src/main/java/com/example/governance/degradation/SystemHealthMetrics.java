package com.example.governance.degradation;

import java.util.Map;

/**
 * System-wide health readings. Rates are fractions (0-1), usages are percentages (0-100).
 *
 * @param extra additional named metrics, e.g. {@code database_error_rate}
 */
public record SystemHealthMetrics(double errorRate,
                                  double responseTimeMs,
                                  double cpuUsage,
                                  double memoryUsage,
                                  double connectionCount,
                                  double requestRate,
                                  Map<String, Double> extra) {

    public static final String ERROR_RATE = "error_rate";
    public static final String RESPONSE_TIME = "response_time";
    public static final String CPU_USAGE = "cpu_usage";
    public static final String MEMORY_USAGE = "memory_usage";
    public static final String CONNECTION_COUNT = "connection_count";
    public static final String REQUEST_RATE = "request_rate";

    public SystemHealthMetrics {
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public static SystemHealthMetrics healthy() {
        return new SystemHealthMetrics(0d, 0d, 0d, 0d, 0d, 0d, Map.of());
    }

    public static SystemHealthMetrics of(double errorRate, double responseTimeMs, double cpuUsage, double memoryUsage) {
        return new SystemHealthMetrics(errorRate, responseTimeMs, cpuUsage, memoryUsage, 0d, 0d, Map.of());
    }

    /** Value of a named metric; unknown metrics read as 0. */
    public double value(String metric) {
        if (metric == null) {
            return 0d;
        }
        return switch (metric) {
            case ERROR_RATE -> errorRate;
            case RESPONSE_TIME -> responseTimeMs;
            case CPU_USAGE -> cpuUsage;
            case MEMORY_USAGE -> memoryUsage;
            case CONNECTION_COUNT -> connectionCount;
            case REQUEST_RATE -> requestRate;
            default -> extra.getOrDefault(metric, 0d);
        };
    }
}
