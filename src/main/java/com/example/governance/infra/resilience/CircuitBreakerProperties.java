package com.example.governance.infra.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "governance.reliability.breaker")
public class CircuitBreakerProperties {

    private boolean enabled = true;

    private double errorThresholdPercentage = 50d;
    private Duration recoveryTimeout = Duration.ofSeconds(60);
    private Duration rollingWindow = Duration.ofSeconds(60);

    /** Hard cap on rolling-window samples, independent of their age. */
    private int maxWindowSamples = 1000;
    private int minimumThroughput = 10;

    private int halfOpenProbeWindow = 5;
    private int halfOpenSuccessThreshold = 3;

    /** Fixed delay between evaluation ticks (OPEN → HALF_OPEN promotion, threshold adaptation). */
    private long evaluationIntervalMs = 5000L;

    private final Adaptive adaptive = new Adaptive();

    /**
     * Optional per-key overrides. The longest matching prefix wins.
     */
    private List<KeyOverride> keyOverrides = new ArrayList<>();

    public CircuitBreakerConfig policyFor(String name) {
        CircuitBreakerConfig base = new CircuitBreakerConfig(
                errorThresholdPercentage,
                recoveryTimeout,
                rollingWindow,
                minimumThroughput,
                maxWindowSamples,
                halfOpenProbeWindow,
                halfOpenSuccessThreshold);
        if (name == null || keyOverrides == null || keyOverrides.isEmpty()) {
            return base;
        }
        KeyOverride best = null;
        for (KeyOverride o : keyOverrides) {
            if (o == null || o.getPrefix() == null || o.getPrefix().isBlank()) {
                continue;
            }
            if (name.startsWith(o.getPrefix())
                    && (best == null || o.getPrefix().length() > best.getPrefix().length())) {
                best = o;
            }
        }
        if (best == null) {
            return base;
        }
        return new CircuitBreakerConfig(
                best.getErrorThresholdPercentage() != null ? best.getErrorThresholdPercentage() : base.errorThresholdPercentage(),
                best.getRecoveryTimeout() != null ? best.getRecoveryTimeout() : base.recoveryTimeout(),
                base.rollingWindow(),
                best.getMinimumThroughput() != null ? best.getMinimumThroughput() : base.minimumThroughput(),
                base.maxWindowSamples(),
                base.halfOpenProbeWindow(),
                base.halfOpenSuccessThreshold());
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getErrorThresholdPercentage() {
        return errorThresholdPercentage;
    }

    public void setErrorThresholdPercentage(double errorThresholdPercentage) {
        this.errorThresholdPercentage = errorThresholdPercentage;
    }

    public Duration getRecoveryTimeout() {
        return recoveryTimeout;
    }

    public void setRecoveryTimeout(Duration recoveryTimeout) {
        this.recoveryTimeout = recoveryTimeout;
    }

    public Duration getRollingWindow() {
        return rollingWindow;
    }

    public void setRollingWindow(Duration rollingWindow) {
        this.rollingWindow = rollingWindow;
    }

    public int getMaxWindowSamples() {
        return maxWindowSamples;
    }

    public void setMaxWindowSamples(int maxWindowSamples) {
        this.maxWindowSamples = maxWindowSamples;
    }

    public int getMinimumThroughput() {
        return minimumThroughput;
    }

    public void setMinimumThroughput(int minimumThroughput) {
        this.minimumThroughput = minimumThroughput;
    }

    public int getHalfOpenProbeWindow() {
        return halfOpenProbeWindow;
    }

    public void setHalfOpenProbeWindow(int halfOpenProbeWindow) {
        this.halfOpenProbeWindow = halfOpenProbeWindow;
    }

    public int getHalfOpenSuccessThreshold() {
        return halfOpenSuccessThreshold;
    }

    public void setHalfOpenSuccessThreshold(int halfOpenSuccessThreshold) {
        this.halfOpenSuccessThreshold = halfOpenSuccessThreshold;
    }

    public long getEvaluationIntervalMs() {
        return evaluationIntervalMs;
    }

    public void setEvaluationIntervalMs(long evaluationIntervalMs) {
        this.evaluationIntervalMs = evaluationIntervalMs;
    }

    public Adaptive getAdaptive() {
        return adaptive;
    }

    public List<KeyOverride> getKeyOverrides() {
        return keyOverrides;
    }

    public void setKeyOverrides(List<KeyOverride> keyOverrides) {
        this.keyOverrides = keyOverrides;
    }

    /**
     * Knobs for the learning part of the breaker. Defaults reproduce the fixed heuristics:
     * lenient (x1.5, cap 80) when most failures are transient, strict (x0.8, floor 20) otherwise.
     */
    public static class Adaptive {
        private boolean enabled = true;
        private int minSamples = 20;
        private double lenientRatio = 0.7d;
        private double strictRatio = 0.3d;
        private double lenientMultiplier = 1.5d;
        private double lenientCap = 80d;
        private double strictMultiplier = 0.8d;
        private double strictFloor = 20d;
        private long defaultResponseTimeThresholdMs = 5000L;
        private int responseTimeSampleSize = 100;
        private Duration historyRetention = Duration.ofHours(24);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMinSamples() {
            return minSamples;
        }

        public void setMinSamples(int minSamples) {
            this.minSamples = minSamples;
        }

        public double getLenientRatio() {
            return lenientRatio;
        }

        public void setLenientRatio(double lenientRatio) {
            this.lenientRatio = lenientRatio;
        }

        public double getStrictRatio() {
            return strictRatio;
        }

        public void setStrictRatio(double strictRatio) {
            this.strictRatio = strictRatio;
        }

        public double getLenientMultiplier() {
            return lenientMultiplier;
        }

        public void setLenientMultiplier(double lenientMultiplier) {
            this.lenientMultiplier = lenientMultiplier;
        }

        public double getLenientCap() {
            return lenientCap;
        }

        public void setLenientCap(double lenientCap) {
            this.lenientCap = lenientCap;
        }

        public double getStrictMultiplier() {
            return strictMultiplier;
        }

        public void setStrictMultiplier(double strictMultiplier) {
            this.strictMultiplier = strictMultiplier;
        }

        public double getStrictFloor() {
            return strictFloor;
        }

        public void setStrictFloor(double strictFloor) {
            this.strictFloor = strictFloor;
        }

        public long getDefaultResponseTimeThresholdMs() {
            return defaultResponseTimeThresholdMs;
        }

        public void setDefaultResponseTimeThresholdMs(long defaultResponseTimeThresholdMs) {
            this.defaultResponseTimeThresholdMs = defaultResponseTimeThresholdMs;
        }

        public int getResponseTimeSampleSize() {
            return responseTimeSampleSize;
        }

        public void setResponseTimeSampleSize(int responseTimeSampleSize) {
            this.responseTimeSampleSize = responseTimeSampleSize;
        }

        public Duration getHistoryRetention() {
            return historyRetention;
        }

        public void setHistoryRetention(Duration historyRetention) {
            this.historyRetention = historyRetention;
        }
    }

    public static class KeyOverride {
        private String prefix;
        private Double errorThresholdPercentage;
        private Duration recoveryTimeout;
        private Integer minimumThroughput;

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public Double getErrorThresholdPercentage() {
            return errorThresholdPercentage;
        }

        public void setErrorThresholdPercentage(Double errorThresholdPercentage) {
            this.errorThresholdPercentage = errorThresholdPercentage;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }

        public Integer getMinimumThroughput() {
            return minimumThroughput;
        }

        public void setMinimumThroughput(Integer minimumThroughput) {
            this.minimumThroughput = minimumThroughput;
        }
    }
}
