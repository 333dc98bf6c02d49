package com.example.governance.infra.resilience;

import java.time.Duration;

/**
 * Fast-fail signal: the breaker is OPEN and the guarded operation was not invoked.
 */
public class OpenCircuitException extends RuntimeException {

    private final String breakerName;
    private final Duration remaining;

    public OpenCircuitException(String breakerName, Duration remaining) {
        super("Circuit breaker '" + breakerName + "' is OPEN (remaining=" + remaining + ")");
        this.breakerName = breakerName;
        this.remaining = remaining == null ? Duration.ZERO : remaining;
    }

    public String breakerName() {
        return breakerName;
    }

    public Duration remaining() {
        return remaining;
    }
}
