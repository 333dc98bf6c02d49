package com.example.governance.orchestration;

import java.util.Locale;

public enum RecoveryApproach {
    SINGLE_AGENT,
    COORDINATED,
    DEGRADATION_ONLY,
    EMERGENCY_FALLBACK;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
