package com.example.governance.error;

import java.util.Objects;

/**
 * Output of an {@link ErrorClassifier}. Produced outside this module and consumed as-is.
 */
public record ErrorClassification(ErrorType errorType,
                                  ErrorSeverity severity,
                                  ImpactScope impactScope,
                                  boolean retryable,
                                  boolean transientError,
                                  boolean requiresImmediateAttention,
                                  long estimatedRecoveryTimeMs,
                                  double confidenceScore) {

    public ErrorClassification {
        Objects.requireNonNull(errorType, "errorType");
        Objects.requireNonNull(severity, "severity");
        impactScope = impactScope == null ? ImpactScope.SINGLE_AGENT : impactScope;
    }

    public static ErrorClassification of(ErrorType type, ErrorSeverity severity, ImpactScope scope) {
        return new ErrorClassification(type, severity, scope, true, type.isTransient(), false, 60_000L, 0.8d);
    }

    public ErrorClassification withImmediateAttention(boolean immediate) {
        return new ErrorClassification(errorType, severity, impactScope, retryable, transientError, immediate,
                estimatedRecoveryTimeMs, confidenceScore);
    }

    public ErrorClassification withRetryable(boolean value) {
        return new ErrorClassification(errorType, severity, impactScope, value, transientError,
                requiresImmediateAttention, estimatedRecoveryTimeMs, confidenceScore);
    }

    public ErrorClassification withEstimatedRecoveryTimeMs(long value) {
        return new ErrorClassification(errorType, severity, impactScope, retryable, transientError,
                requiresImmediateAttention, value, confidenceScore);
    }
}
