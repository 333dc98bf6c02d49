package com.example.governance.degradation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

@Slf4j
@RequiredArgsConstructor
public class DegradationAssessmentScheduler {

    private final DegradationManager manager;
    private final DegradationProperties props;

    @Scheduled(fixedDelayString = "${governance.reliability.degradation.assessment-interval-ms:30000}")
    public void assess() {
        if (!props.isEnabled()) {
            return;
        }
        try {
            manager.performAutomaticAssessment();
        } catch (RuntimeException e) {
            log.error("[degradation] automatic assessment failed: {}", e.toString(), e);
        }
    }
}
