package com.example.governance.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * In-process transport used when no agent gateway is configured: every agent is reported
 * healthy and notifications are only logged.
 */
@Slf4j
public class LocalAgentTransport implements AgentTransport {

    @Override
    public CompletableFuture<Boolean> checkHealth(String agentId) {
        return CompletableFuture.completedFuture(Boolean.TRUE);
    }

    @Override
    public CompletableFuture<Void> notify(String agentId, AgentNotification notification) {
        log.info("[transport] local notify agent={} type={} ref={}", agentId, notification.type(), notification.reference());
        return CompletableFuture.completedFuture(null);
    }
}
