package com.example.governance.config;

import com.example.governance.coordination.ConsensusManager;
import com.example.governance.coordination.CoordinationProperties;
import com.example.governance.coordination.LeaderElection;
import com.example.governance.coordination.RecoveryCoordinator;
import com.example.governance.coordination.RecoveryPlanExecutor;
import com.example.governance.coordination.RecoveryPlanFactory;
import com.example.governance.coordination.SessionMonitor;
import com.example.governance.degradation.AdaptiveDegradationController;
import com.example.governance.degradation.DegradationLevelCatalog;
import com.example.governance.degradation.DegradationManager;
import com.example.governance.degradation.DegradationMetricsCollector;
import com.example.governance.degradation.DegradationProperties;
import com.example.governance.degradation.FallbackActivator;
import com.example.governance.degradation.SnapshotSystemMetricsSource;
import com.example.governance.degradation.SystemMetricsSource;
import com.example.governance.error.ErrorClassifier;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.orchestration.ErrorHandlingService;
import com.example.governance.recovery.RecoveryManager;
import com.example.governance.recovery.RecoveryProperties;
import com.example.governance.recovery.RecoveryStrategyCatalog;
import com.example.governance.recovery.RecoveryStrategyExecutor;
import com.example.governance.recovery.RecoveryStrategySelector;
import com.example.governance.recovery.action.DispatchingRecoveryActionExecutor;
import com.example.governance.recovery.action.RecoveryActionExecutor;
import com.example.governance.resilience.SingleFlightManager;
import com.example.governance.store.ReliabilityStore;
import com.example.governance.transport.AgentTransport;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Degradation, single-agent recovery, coordinated recovery and the error-handling entry point.
 */
@Configuration
@EnableConfigurationProperties({
        DegradationProperties.class,
        RecoveryProperties.class,
        CoordinationProperties.class
})
public class RecoveryConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DegradationLevelCatalog degradationLevelCatalog() {
        return DegradationLevelCatalog.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public SystemMetricsSource systemMetricsSource() {
        return new SnapshotSystemMetricsSource();
    }

    /**
     * Fallback actions go through the same executor as recovery actions, which itself needs
     * the degradation manager; the provider defers the lookup to activation time.
     */
    @Bean
    public DegradationManager degradationManager(DegradationLevelCatalog catalog,
                                                 SystemMetricsSource metricsSource,
                                                 ReliabilityStore store,
                                                 ReliabilityEventPublisher events,
                                                 DegradationProperties props,
                                                 Clock clock,
                                                 ObjectProvider<RecoveryActionExecutor> actionExecutor) {
        FallbackActivator activator = s -> actionExecutor.getObject().executeAndWait(s.fallbackAction(), null);
        return new DegradationManager(catalog,
                new AdaptiveDegradationController(props),
                new DegradationMetricsCollector(clock, props.getChangeHistoryRetention()),
                metricsSource, store, events, props, clock, activator);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecoveryActionExecutor recoveryActionExecutor(CircuitBreakerRegistry breakers,
                                                         DegradationManager degradationManager,
                                                         AgentTransport transport,
                                                         ReliabilityEventPublisher events) {
        return new DispatchingRecoveryActionExecutor(breakers, degradationManager, transport, events);
    }

    @Bean
    public RecoveryManager recoveryManager(DegradationLevelCatalog levels,
                                           RecoveryActionExecutor actionExecutor,
                                           AgentTransport transport,
                                           CircuitBreakerRegistry breakers,
                                           SingleFlightManager singleFlight,
                                           ReliabilityStore store,
                                           ReliabilityEventPublisher events,
                                           RecoveryProperties props,
                                           Clock clock) {
        RecoveryStrategyExecutor strategyExecutor =
                new RecoveryStrategyExecutor(actionExecutor, transport, props.getHealthCheckTimeout(), clock);
        return new RecoveryManager(new RecoveryStrategyCatalog(levels.maxLevel()), new RecoveryStrategySelector(),
                strategyExecutor, breakers, singleFlight, store, events, props, clock);
    }

    @Bean
    public RecoveryCoordinator recoveryCoordinator(AgentTransport transport,
                                                   RecoveryActionExecutor actionExecutor,
                                                   ReliabilityStore store,
                                                   ReliabilityEventPublisher events,
                                                   CoordinationProperties props,
                                                   Clock clock) {
        return new RecoveryCoordinator(transport,
                new RecoveryPlanFactory(clock),
                new LeaderElection(transport, props.getVoteTimeout()),
                new ConsensusManager(transport, props.getVoteTimeout(), props.getConsensusRatio()),
                new RecoveryPlanExecutor(actionExecutor, transport, props.getHealthCheckTimeout(), clock),
                store, events, props, clock);
    }

    @Bean
    public SessionMonitor sessionMonitor(RecoveryCoordinator coordinator, CoordinationProperties props) {
        return new SessionMonitor(coordinator, props.getStuckAfter());
    }

    @Bean
    public ErrorHandlingService errorHandlingService(ErrorClassifier classifier,
                                                     RecoveryManager recoveryManager,
                                                     RecoveryCoordinator coordinator,
                                                     DegradationManager degradationManager,
                                                     CircuitBreakerRegistry breakers,
                                                     CoordinationProperties props,
                                                     ReliabilityEventPublisher events,
                                                     Clock clock) {
        return new ErrorHandlingService(classifier, recoveryManager, coordinator, degradationManager, breakers,
                props, events, clock);
    }
}
