package com.example.governance.recovery;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "governance.reliability.recovery")
public class RecoveryProperties {

    /** Open duration of the per-strategy {@code recovery_<strategyId>} breakers. */
    private Duration breakerRecoveryTimeout = Duration.ofSeconds(30);

    /** Attempts kept per agent for {@code getRecoveryHistory}. */
    private int historySize = 100;

    private Duration historyTtl = Duration.ofHours(24);

    private Duration healthCheckTimeout = Duration.ofSeconds(5);

    public Duration getBreakerRecoveryTimeout() {
        return breakerRecoveryTimeout;
    }

    public void setBreakerRecoveryTimeout(Duration breakerRecoveryTimeout) {
        this.breakerRecoveryTimeout = breakerRecoveryTimeout;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public Duration getHistoryTtl() {
        return historyTtl;
    }

    public void setHistoryTtl(Duration historyTtl) {
        this.historyTtl = historyTtl;
    }

    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }

    public void setHealthCheckTimeout(Duration healthCheckTimeout) {
        this.healthCheckTimeout = healthCheckTimeout;
    }
}
