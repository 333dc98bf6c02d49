package com.example.governance.observability;

import com.example.governance.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class ReliabilityEventPublisherTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void failingListenerDoesNotStopDelivery() {
        ReliabilityEventPublisher publisher = new ReliabilityEventPublisher(clock);
        List<ReliabilityEvent> received = new ArrayList<>();
        publisher.subscribe(e -> {
            throw new IllegalStateException("listener bug");
        });
        publisher.subscribe(received::add);

        publisher.publish("recovery", "recovery_completed", "err-1", Map.of("strategy", "cache_clear"));

        assertThat(received).singleElement().satisfies(e -> {
            assertThat(e.timestamp()).isEqualTo(clock.instant());
            assertThat(e.data()).containsEntry("strategy", "cache_clear");
        });
    }

    @Test
    void nullValuesAreDroppedAndRegistrationUnsubscribes() {
        ReliabilityEventPublisher publisher = new ReliabilityEventPublisher(clock);
        List<ReliabilityEvent> received = new ArrayList<>();
        ReliabilityEventPublisher.Registration reg = publisher.subscribe(received::add);
        Map<String, Object> data = new HashMap<>();
        data.put("error", null);
        data.put("duration_ms", 12L);

        publisher.publish("recovery", "recovery_failed", "err-1", data);
        reg.close();
        publisher.publish("recovery", "recovery_failed", "err-2");

        assertThat(received).hasSize(1);
        assertThat(received.get(0).data()).containsOnlyKeys("duration_ms");
        assertThat(publisher.listenerCount()).isZero();
    }

    @Test
    void micrometerListenerCountsBySourceAndType() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ReliabilityEventPublisher publisher = new ReliabilityEventPublisher(clock);
        publisher.subscribe(new MicrometerReliabilityEventListener(registry));

        publisher.publish("circuit_breaker", "opened", "db");
        publisher.publish("circuit_breaker", "opened", "cache");
        publisher.publish("degradation", "escalation", "2");

        assertThat(registry.get(MicrometerReliabilityEventListener.DEFAULT_COUNTER_NAME)
                .tags("source", "circuit_breaker", "type", "opened").counter().count()).isEqualTo(2d);
        assertThat(registry.get(MicrometerReliabilityEventListener.DEFAULT_COUNTER_NAME)
                .tags("source", "degradation", "type", "escalation").counter().count()).isEqualTo(1d);
    }
}
