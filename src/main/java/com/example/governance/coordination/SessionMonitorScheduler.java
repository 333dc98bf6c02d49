package com.example.governance.coordination;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class SessionMonitorScheduler {

    private final SessionMonitor monitor;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${governance.reliability.coordination.monitor-interval-ms:30000}")
    public void check() {
        try {
            List<String> aborted = monitor.checkSessions(clock.instant());
            if (!aborted.isEmpty()) {
                log.info("[monitor] aborted sessions={}", aborted);
            }
        } catch (RuntimeException e) {
            log.error("[monitor] session check failed: {}", e.toString(), e);
        }
    }
}
