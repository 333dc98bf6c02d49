package com.example.governance.coordination;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "governance.reliability.coordination")
public class CoordinationProperties {

    private boolean enabled = true;

    private long monitorIntervalMs = 30_000L;

    /** An executing session with no event for this long is aborted by the monitor. */
    private Duration stuckAfter = Duration.ofMinutes(5);

    private Duration healthCheckTimeout = Duration.ofSeconds(5);

    private Duration notifyTimeout = Duration.ofSeconds(5);

    private Duration voteTimeout = Duration.ofSeconds(5);

    /** Share of cast votes needed when a consensus strategy carries no explicit threshold. */
    private double consensusRatio = 0.6d;

    /** Finished sessions stay readable through getSession/monitorRecoveryProgress this long. */
    private Duration finishedSessionRetention = Duration.ofHours(1);

    private long maxFinishedSessions = 1_000L;

    /** Agents added to system-wide coordinated recoveries. */
    private List<String> fleetAgents = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getMonitorIntervalMs() {
        return monitorIntervalMs;
    }

    public void setMonitorIntervalMs(long monitorIntervalMs) {
        this.monitorIntervalMs = monitorIntervalMs;
    }

    public Duration getStuckAfter() {
        return stuckAfter;
    }

    public void setStuckAfter(Duration stuckAfter) {
        this.stuckAfter = stuckAfter;
    }

    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }

    public void setHealthCheckTimeout(Duration healthCheckTimeout) {
        this.healthCheckTimeout = healthCheckTimeout;
    }

    public Duration getNotifyTimeout() {
        return notifyTimeout;
    }

    public void setNotifyTimeout(Duration notifyTimeout) {
        this.notifyTimeout = notifyTimeout;
    }

    public Duration getVoteTimeout() {
        return voteTimeout;
    }

    public void setVoteTimeout(Duration voteTimeout) {
        this.voteTimeout = voteTimeout;
    }

    public double getConsensusRatio() {
        return consensusRatio;
    }

    public void setConsensusRatio(double consensusRatio) {
        this.consensusRatio = consensusRatio;
    }

    public Duration getFinishedSessionRetention() {
        return finishedSessionRetention;
    }

    public void setFinishedSessionRetention(Duration finishedSessionRetention) {
        this.finishedSessionRetention = finishedSessionRetention;
    }

    public long getMaxFinishedSessions() {
        return maxFinishedSessions;
    }

    public void setMaxFinishedSessions(long maxFinishedSessions) {
        this.maxFinishedSessions = maxFinishedSessions;
    }

    public List<String> getFleetAgents() {
        return fleetAgents;
    }

    public void setFleetAgents(List<String> fleetAgents) {
        this.fleetAgents = fleetAgents;
    }
}
