package com.example.governance.error;

import java.util.Locale;

public enum ImpactScope {
    SINGLE_REQUEST,
    SINGLE_AGENT,
    AGENT_CLUSTER,
    SYSTEM_WIDE,
    CROSS_SYSTEM;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
