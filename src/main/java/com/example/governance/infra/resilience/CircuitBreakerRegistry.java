package com.example.governance.infra.resilience;

import com.example.governance.observability.ReliabilityEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * One breaker per protected resource, created lazily on first use.
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    /** Breakers that guard recovery itself; system-wide toggles leave them alone. */
    public static final String RECOVERY_GUARD_PREFIX = "recovery_";

    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerProperties props;
    private final Clock clock;
    private final ReliabilityEventPublisher events;

    public CircuitBreakerRegistry(CircuitBreakerProperties props, Clock clock, ReliabilityEventPublisher events) {
        this.props = props == null ? new CircuitBreakerProperties() : props;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.events = events;
    }

    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, k -> create(k, props.policyFor(k)));
    }

    /**
     * Returns the existing breaker, or creates one with {@code config}. An existing breaker
     * keeps the configuration it was created with.
     */
    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        return breakers.computeIfAbsent(name, k -> create(k, config == null ? props.policyFor(k) : config));
    }

    private CircuitBreaker create(String name, CircuitBreakerConfig config) {
        log.debug("[breaker] created name={} threshold={}% minThroughput={} recoveryTimeout={}",
                name, config.errorThresholdPercentage(), config.minimumThroughput(), config.recoveryTimeout());
        return new CircuitBreaker(name, config, props.getAdaptive(), clock, events);
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(name == null ? null : breakers.get(name));
    }

    public Collection<String> names() {
        return List.copyOf(breakers.keySet());
    }

    public void evaluateAll() {
        for (CircuitBreaker b : breakers.values()) {
            try {
                b.evaluateState();
            } catch (RuntimeException e) {
                log.warn("[breaker] evaluation failed name={}: {}", b.name(), e.toString());
            }
        }
    }

    public static boolean isRecoveryGuard(String name) {
        return name != null && name.startsWith(RECOVERY_GUARD_PREFIX);
    }

    /** Emergency path: opens every known breaker, recovery guards included. */
    public List<String> forceOpenAll() {
        return forceOpenAll(name -> true, null);
    }

    /**
     * Opens the breakers whose name matches {@code filter} for {@code openFor}, or for each
     * breaker's recovery timeout when {@code openFor} is null. Returns the names that were opened.
     */
    public List<String> forceOpenAll(Predicate<String> filter, Duration openFor) {
        List<String> opened = new ArrayList<>();
        for (CircuitBreaker b : breakers.values()) {
            if (filter.test(b.name())) {
                b.forceOpen(openFor);
                opened.add(b.name());
            }
        }
        return opened;
    }

    /** Opens every protected resource, leaving the recovery guards closed. */
    public List<String> forceOpenResources(Duration openFor) {
        return forceOpenAll(name -> !isRecoveryGuard(name), openFor);
    }

    /** Compensates {@link #forceOpenAll()}. Returns the names that were closed. */
    public List<String> forceCloseAll() {
        return forceCloseAll(name -> true);
    }

    public List<String> forceCloseAll(Predicate<String> filter) {
        List<String> closed = new ArrayList<>();
        for (CircuitBreaker b : breakers.values()) {
            if (filter.test(b.name())) {
                b.forceClose();
                closed.add(b.name());
            }
        }
        return closed;
    }

    /** Compensates {@link #forceOpenResources(Duration)}. */
    public List<String> forceCloseResources() {
        return forceCloseAll(name -> !isRecoveryGuard(name));
    }

    public Map<String, CircuitBreakerState> snapshot() {
        Map<String, CircuitBreakerState> out = new TreeMap<>();
        breakers.forEach((k, v) -> out.put(k, v.getState()));
        return out;
    }

    public int size() {
        return breakers.size();
    }
}
