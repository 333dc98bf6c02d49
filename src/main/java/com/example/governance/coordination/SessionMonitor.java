package com.example.governance.coordination;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Aborts sessions that outlived their strategy timeout, and executing sessions that have
 * logged nothing for {@code stuckAfter}.
 */
@Slf4j
public class SessionMonitor {

    private final RecoveryCoordinator coordinator;
    private final Duration stuckAfter;

    public SessionMonitor(RecoveryCoordinator coordinator, Duration stuckAfter) {
        this.coordinator = coordinator;
        this.stuckAfter = stuckAfter;
    }

    /** Returns the ids of the sessions aborted by this pass. */
    public List<String> checkSessions(Instant now) {
        List<String> aborted = new ArrayList<>();
        for (RecoveryCoordinationSession session : coordinator.getActiveSessions()) {
            String issue = issueOf(session, now);
            if (issue == null) {
                continue;
            }
            log.warn("[monitor] session={} issue={}", session.sessionId(), issue);
            try {
                coordinator.abortRecoverySession(session.sessionId(), "Monitoring issue: " + issue);
                aborted.add(session.sessionId());
            } catch (CoordinationException e) {
                // finished between the snapshot and the abort
                log.debug("[monitor] session={} no longer active: {}", session.sessionId(), e.getMessage());
            }
        }
        return aborted;
    }

    String issueOf(RecoveryCoordinationSession session, Instant now) {
        if (session.isTerminal()) {
            return null;
        }
        long age = Duration.between(session.startedAt(), now).toMillis();
        if (age > session.coordinationStrategy().timeoutMs()) {
            return "Session timeout exceeded";
        }
        if (session.status() == CoordinationStatus.EXECUTING) {
            Instant last = session.lastEventTime().orElse(session.startedAt());
            if (Duration.between(last, now).compareTo(stuckAfter) > 0) {
                return "Session appears stuck - no activity";
            }
        }
        return null;
    }
}
