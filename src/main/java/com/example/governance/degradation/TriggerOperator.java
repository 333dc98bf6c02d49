package com.example.governance.degradation;

import java.util.Locale;

public enum TriggerOperator {
    GT, GTE, LT, LTE, EQ, CONTAINS;

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GT -> value > threshold;
            case GTE -> value >= threshold;
            case LT -> value < threshold;
            case LTE -> value <= threshold;
            case EQ -> Double.compare(value, threshold) == 0;
            case CONTAINS -> String.valueOf(value).contains(String.valueOf(threshold));
        };
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
