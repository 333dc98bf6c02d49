package com.example.governance.error;

import java.util.Locale;

/**
 * Error taxonomy shared by the breaker, recovery strategies and the coordinator.
 *
 * <p>{@link #code()} is the snake_case name used in persisted rows and event payloads.</p>
 */
public enum ErrorType {
    NETWORK_ERROR,
    TIMEOUT_ERROR,
    DATABASE_ERROR,
    AUTHENTICATION_ERROR,
    AUTHORIZATION_ERROR,
    RATE_LIMIT_ERROR,
    RESOURCE_EXHAUSTION,
    AGENT_COORDINATION_ERROR,
    DEPENDENCY_ERROR,
    DATA_CORRUPTION_ERROR,
    BUSINESS_LOGIC_ERROR,
    SYSTEM_ERROR,
    VALIDATION_ERROR,
    CONFIGURATION_ERROR,
    PROTOCOL_ERROR;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Timeout, network and rate-limit failures usually go away on their own. */
    public boolean isTransient() {
        return this == TIMEOUT_ERROR || this == NETWORK_ERROR || this == RATE_LIMIT_ERROR;
    }

    public static ErrorType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return SYSTEM_ERROR;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return SYSTEM_ERROR;
        }
    }
}
