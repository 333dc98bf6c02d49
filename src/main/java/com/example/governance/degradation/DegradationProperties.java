package com.example.governance.degradation;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Degradation thresholds. Defaults match the built-in level catalog.
 */
@ConfigurationProperties(prefix = "governance.reliability.degradation")
public class DegradationProperties {

    /** Master switch for the background assessment loop. */
    private boolean enabled = true;

    private long assessmentIntervalMs = 30_000L;

    /** Minimum time at a level before automatic recovery may step down. */
    private Duration stabilityPeriod = Duration.ofMinutes(5);

    /** More level changes than this within the last hour limit escalation to a single step. */
    private int antiFlapChangesPerHour = 5;

    /** Retention of level-change records. */
    private Duration changeHistoryRetention = Duration.ofHours(24);

    private final Recovery recovery = new Recovery();
    private final Escalation escalation = new Escalation();
    private final Severe severe = new Severe();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getAssessmentIntervalMs() {
        return assessmentIntervalMs;
    }

    public void setAssessmentIntervalMs(long assessmentIntervalMs) {
        this.assessmentIntervalMs = assessmentIntervalMs;
    }

    public Duration getStabilityPeriod() {
        return stabilityPeriod;
    }

    public void setStabilityPeriod(Duration stabilityPeriod) {
        this.stabilityPeriod = stabilityPeriod;
    }

    public int getAntiFlapChangesPerHour() {
        return antiFlapChangesPerHour;
    }

    public void setAntiFlapChangesPerHour(int antiFlapChangesPerHour) {
        this.antiFlapChangesPerHour = antiFlapChangesPerHour;
    }

    public Duration getChangeHistoryRetention() {
        return changeHistoryRetention;
    }

    public void setChangeHistoryRetention(Duration changeHistoryRetention) {
        this.changeHistoryRetention = changeHistoryRetention;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public Severe getSevere() {
        return severe;
    }

    /** Upper bounds that must all hold before stepping down a level. */
    public static class Recovery {
        private double maxErrorRate = 0.05d;
        private double maxResponseTimeMs = 5000d;
        private double maxCpuUsage = 80d;
        private double maxMemoryUsage = 85d;

        public double getMaxErrorRate() {
            return maxErrorRate;
        }

        public void setMaxErrorRate(double maxErrorRate) {
            this.maxErrorRate = maxErrorRate;
        }

        public double getMaxResponseTimeMs() {
            return maxResponseTimeMs;
        }

        public void setMaxResponseTimeMs(double maxResponseTimeMs) {
            this.maxResponseTimeMs = maxResponseTimeMs;
        }

        public double getMaxCpuUsage() {
            return maxCpuUsage;
        }

        public void setMaxCpuUsage(double maxCpuUsage) {
            this.maxCpuUsage = maxCpuUsage;
        }

        public double getMaxMemoryUsage() {
            return maxMemoryUsage;
        }

        public void setMaxMemoryUsage(double maxMemoryUsage) {
            this.maxMemoryUsage = maxMemoryUsage;
        }
    }

    /** Thresholds the background assessment raises triggers for. */
    public static class Escalation {
        private double errorRate = 0.1d;
        private double responseTimeMs = 10_000d;
        private double cpuUsage = 90d;
        private double memoryUsage = 95d;

        public double getErrorRate() {
            return errorRate;
        }

        public void setErrorRate(double errorRate) {
            this.errorRate = errorRate;
        }

        public double getResponseTimeMs() {
            return responseTimeMs;
        }

        public void setResponseTimeMs(double responseTimeMs) {
            this.responseTimeMs = responseTimeMs;
        }

        public double getCpuUsage() {
            return cpuUsage;
        }

        public void setCpuUsage(double cpuUsage) {
            this.cpuUsage = cpuUsage;
        }

        public double getMemoryUsage() {
            return memoryUsage;
        }

        public void setMemoryUsage(double memoryUsage) {
            this.memoryUsage = memoryUsage;
        }
    }

    /** Trigger values above these escalate two levels at once. */
    public static class Severe {
        private double errorRate = 0.2d;
        private double cpuUsage = 95d;
        private double memoryUsage = 95d;

        public double getErrorRate() {
            return errorRate;
        }

        public void setErrorRate(double errorRate) {
            this.errorRate = errorRate;
        }

        public double getCpuUsage() {
            return cpuUsage;
        }

        public void setCpuUsage(double cpuUsage) {
            this.cpuUsage = cpuUsage;
        }

        public double getMemoryUsage() {
            return memoryUsage;
        }

        public void setMemoryUsage(double memoryUsage) {
            this.memoryUsage = memoryUsage;
        }
    }
}
