package com.example.governance.config;

import com.example.governance.coordination.RecoveryCoordinator;
import com.example.governance.coordination.SessionMonitorScheduler;
import com.example.governance.degradation.DegradationManager;
import com.example.governance.error.ErrorClassifier;
import com.example.governance.error.ErrorContext;
import com.example.governance.error.TypeBasedErrorClassifier;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import com.example.governance.orchestration.ErrorHandlingResult;
import com.example.governance.orchestration.ErrorHandlingService;
import com.example.governance.orchestration.RecoveryApproach;
import com.example.governance.recovery.RecoveryManager;
import com.example.governance.recovery.action.DispatchingRecoveryActionExecutor;
import com.example.governance.recovery.action.RecoveryActionExecutor;
import com.example.governance.store.InMemoryReliabilityStore;
import com.example.governance.store.ReliabilityStore;
import com.example.governance.transport.AgentTransport;
import com.example.governance.transport.LocalAgentTransport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "governance.reliability.scheduling.enabled=false")
public class ReliabilityConfigurationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private ErrorHandlingService errorHandling;

    @Test
    void wiresDefaultsWithoutGatewayOrJournal() {
        assertThat(context.getBean(AgentTransport.class)).isInstanceOf(LocalAgentTransport.class);
        assertThat(context.getBean(ReliabilityStore.class)).isInstanceOf(InMemoryReliabilityStore.class);
        assertThat(context.getBean(ErrorClassifier.class)).isInstanceOf(TypeBasedErrorClassifier.class);
        assertThat(context.getBean(RecoveryActionExecutor.class)).isInstanceOf(DispatchingRecoveryActionExecutor.class);
        assertThat(context.getBean(RecoveryManager.class)).isNotNull();
        assertThat(context.getBean(RecoveryCoordinator.class)).isNotNull();
        assertThat(context.getBean(DegradationManager.class).getCurrentLevel().level()).isZero();
        assertThat(context.getBeansOfType(SessionMonitorScheduler.class)).isEmpty();
    }

    @Test
    void handlesNetworkFailureThroughSingleAgentRecovery() {
        ErrorHandlingResult result = errorHandling.handleError(new ConnectException("Connection refused"),
                ErrorContext.of("smoke-1", "agent-smoke", "worker"));

        assertThat(result.approach()).isEqualTo(RecoveryApproach.SINGLE_AGENT);
        assertThat(result.recoveryResult()).isNotNull();
        assertThat(context.getBean(CircuitBreakerRegistry.class).find("recovery_agent-smoke")).isPresent();
    }
}
