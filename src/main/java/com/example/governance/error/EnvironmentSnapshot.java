package com.example.governance.error;

/**
 * Resource readings captured when the error happened.
 *
 * @param memoryUsage       memory usage in percent (0-100)
 * @param cpuUsage          cpu usage in percent (0-100)
 * @param activeConnections open connections at capture time
 * @param runtimeVersion    runtime identifier, informational only
 */
public record EnvironmentSnapshot(double memoryUsage,
                                  double cpuUsage,
                                  int activeConnections,
                                  String runtimeVersion) {

    public static EnvironmentSnapshot empty() {
        return new EnvironmentSnapshot(0d, 0d, 0, System.getProperty("java.version", "unknown"));
    }
}
