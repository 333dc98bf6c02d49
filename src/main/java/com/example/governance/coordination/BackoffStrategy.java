package com.example.governance.coordination;

import java.util.Locale;

public enum BackoffStrategy {
    LINEAR,
    EXPONENTIAL,
    FIXED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
