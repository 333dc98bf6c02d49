package com.example.governance.coordination;

import java.util.Locale;

public enum CoordinationType {
    CENTRALIZED,
    HIERARCHICAL,
    CONSENSUS,
    DISTRIBUTED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
