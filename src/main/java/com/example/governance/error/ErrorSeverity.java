package com.example.governance.error;

import java.util.Locale;

/** Ordered from least to most severe; {@link #compareTo} follows that order. */
public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL,
    EMERGENCY;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** 0 for LOW up to 4 for EMERGENCY; carried as the value of severity triggers. */
    public int rank() {
        return ordinal();
    }

    public boolean isAtLeast(ErrorSeverity other) {
        return compareTo(other) >= 0;
    }
}
