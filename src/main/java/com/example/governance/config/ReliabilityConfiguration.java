package com.example.governance.config;

import com.example.governance.error.ErrorClassifier;
import com.example.governance.error.TypeBasedErrorClassifier;
import com.example.governance.infra.resilience.CircuitBreakerProperties;
import com.example.governance.infra.resilience.CircuitBreakerRegistry;
import com.example.governance.observability.MicrometerReliabilityEventListener;
import com.example.governance.observability.ReliabilityEventPublisher;
import com.example.governance.resilience.SingleFlightManager;
import com.example.governance.store.InMemoryReliabilityStore;
import com.example.governance.store.JsonlReliabilityStore;
import com.example.governance.store.ReliabilityStore;
import com.example.governance.store.StoreProperties;
import com.example.governance.transport.AgentTransport;
import com.example.governance.transport.HttpAgentTransport;
import com.example.governance.transport.LocalAgentTransport;
import com.example.governance.transport.TransportProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure: clock, worker pool, events, breakers, persistence and the agent
 * transport.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        ExecutorProperties.class,
        CircuitBreakerProperties.class,
        StoreProperties.class,
        TransportProperties.class
})
public class ReliabilityConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "reliabilityExecutor", destroyMethod = "shutdown")
    public ExecutorService reliabilityExecutor(ExecutorProperties props) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, props.getPoolSize()), r -> {
            Thread t = new Thread(r, "reliability-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public SingleFlightManager singleFlightManager(ExecutorService reliabilityExecutor) {
        return new SingleFlightManager(reliabilityExecutor);
    }

    @Bean
    public ReliabilityEventPublisher reliabilityEventPublisher(Clock clock,
                                                               ObjectProvider<MeterRegistry> meterRegistry) {
        ReliabilityEventPublisher publisher = new ReliabilityEventPublisher(clock);
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null) {
            publisher.subscribe(new MicrometerReliabilityEventListener(registry));
        }
        return publisher;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerProperties props,
                                                         Clock clock,
                                                         ReliabilityEventPublisher events) {
        return new CircuitBreakerRegistry(props, clock, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReliabilityStore reliabilityStore(StoreProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        if (props.isJsonlEnabled()) {
            log.info("[store] writing reliability rows under {}", props.getDirectory());
            return new JsonlReliabilityStore(objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules()), props);
        }
        return new InMemoryReliabilityStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentTransport agentTransport(TransportProperties props, ObjectProvider<WebClient.Builder> builder) {
        String baseUrl = props.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("[transport] no agent gateway configured, using local transport");
            return new LocalAgentTransport();
        }
        WebClient client = builder.getIfAvailable(WebClient::builder).baseUrl(baseUrl).build();
        return new HttpAgentTransport(client, props.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new TypeBasedErrorClassifier();
    }
}
