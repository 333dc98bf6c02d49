package com.example.governance.coordination;

public record RetryPolicy(int maxAttempts, BackoffStrategy backoff, long baseDelayMs, long maxDelayMs) {

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        backoff = backoff == null ? BackoffStrategy.FIXED : backoff;
    }

    /** Delay before retry {@code attempt} (1-based), capped at {@code maxDelayMs}. */
    public long delayForAttempt(int attempt) {
        int n = Math.max(1, attempt);
        long raw = switch (backoff) {
            case LINEAR -> baseDelayMs * n;
            case EXPONENTIAL -> baseDelayMs * (1L << Math.min(n - 1, 30));
            case FIXED -> baseDelayMs;
        };
        return Math.min(raw, maxDelayMs);
    }
}
