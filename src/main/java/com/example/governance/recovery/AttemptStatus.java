package com.example.governance.recovery;

import java.util.Locale;

public enum AttemptStatus {
    EXECUTING,
    COMPLETED,
    FAILED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
