package com.example.governance.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer counters for reliability events.
 *
 * <p>Tags stay low-cardinality: only source + type, never the key.</p>
 */
public final class MicrometerReliabilityEventListener implements ReliabilityEventListener {

    public static final String DEFAULT_COUNTER_NAME = "governance.reliability.events";

    private final MeterRegistry registry; // may be null (fail-soft)
    private final String counterName;
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public MicrometerReliabilityEventListener(MeterRegistry registry) {
        this(registry, DEFAULT_COUNTER_NAME);
    }

    public MicrometerReliabilityEventListener(MeterRegistry registry, String counterName) {
        this.registry = registry;
        this.counterName = counterName == null ? DEFAULT_COUNTER_NAME : counterName;
    }

    @Override
    public void onEvent(ReliabilityEvent event) {
        if (registry == null || event == null) {
            return;
        }
        String source = safeTag(event.source());
        String type = safeTag(event.type());
        Counter c = counters.computeIfAbsent(source + "|" + type,
                k -> Counter.builder(counterName)
                        .tag("source", source)
                        .tag("type", type)
                        .register(registry));
        c.increment();
    }

    private static String safeTag(String raw) {
        if (raw == null) {
            return "none";
        }
        String s = raw.trim();
        if (s.isEmpty()) {
            return "none";
        }
        if (s.length() > 64) {
            s = s.substring(0, 64);
        }
        return s.toLowerCase(Locale.ROOT).replace(' ', '_');
    }
}
