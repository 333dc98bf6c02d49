package com.example.governance.config;

import com.example.governance.coordination.SessionMonitor;
import com.example.governance.coordination.SessionMonitorScheduler;
import com.example.governance.degradation.DegradationAssessmentScheduler;
import com.example.governance.degradation.DegradationManager;
import com.example.governance.degradation.DegradationProperties;
import com.example.governance.infra.resilience.CircuitBreakerEvaluationScheduler;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "governance.reliability.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReliabilitySchedulingConfig {

    @Bean(name = "reliabilityTaskScheduler")
    public ThreadPoolTaskScheduler reliabilityTaskScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setRemoveOnCancelPolicy(true);
        s.setThreadNamePrefix("reliability-sched-");
        return s;
    }

    @Bean
    public CircuitBreakerEvaluationScheduler circuitBreakerEvaluationScheduler(CircuitBreakerRegistry registry) {
        return new CircuitBreakerEvaluationScheduler(registry);
    }

    @Bean
    public DegradationAssessmentScheduler degradationAssessmentScheduler(DegradationManager manager,
                                                                         DegradationProperties props) {
        return new DegradationAssessmentScheduler(manager, props);
    }

    @Bean
    @ConditionalOnProperty(prefix = "governance.reliability.coordination", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SessionMonitorScheduler sessionMonitorScheduler(SessionMonitor monitor, Clock clock) {
        return new SessionMonitorScheduler(monitor, clock);
    }
}
