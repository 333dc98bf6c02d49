package com.example.governance.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Explicit observer registry. Delivery is synchronous and fail-soft: a listener that throws
 * is logged and skipped, the publishing flow never sees the failure.
 */
public class ReliabilityEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ReliabilityEventPublisher.class);

    private final List<ReliabilityEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public ReliabilityEventPublisher() {
        this(Clock.systemUTC());
    }

    public ReliabilityEventPublisher(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Registration subscribe(ReliabilityEventListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(String source, String type, String key) {
        publish(source, type, key, Map.of());
    }

    public void publish(String source, String type, String key, Map<String, ?> data) {
        Map<String, Object> payload = new HashMap<>();
        if (data != null) {
            data.forEach((k, v) -> {
                if (k != null && v != null) {
                    payload.put(k, v);
                }
            });
        }
        ReliabilityEvent event = new ReliabilityEvent(source, type, key, clock.instant(), payload);
        for (ReliabilityEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[reliability-event] listener failed source={} type={} key={}: {}",
                        source, type, key, e.toString());
            }
        }
    }

    int listenerCount() {
        return listeners.size();
    }

    /** Handle returned by {@link #subscribe}; closing it removes the listener. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
