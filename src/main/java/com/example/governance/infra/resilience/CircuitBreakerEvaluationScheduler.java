package com.example.governance.infra.resilience;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Drives {@link CircuitBreakerRegistry#evaluateAll()} on its own timer.
 */
@Slf4j
@RequiredArgsConstructor
public class CircuitBreakerEvaluationScheduler {

    private final CircuitBreakerRegistry registry;

    @Scheduled(fixedDelayString = "${governance.reliability.breaker.evaluation-interval-ms:5000}")
    public void tick() {
        if (registry.size() == 0) {
            return;
        }
        registry.evaluateAll();
        log.trace("[breaker] evaluated {} breakers", registry.size());
    }
}
