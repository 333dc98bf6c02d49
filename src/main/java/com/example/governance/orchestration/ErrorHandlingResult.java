package com.example.governance.orchestration;

import com.example.governance.error.ErrorClassification;
import com.example.governance.recovery.RecoveryResult;

/**
 * Outcome of {@link ErrorHandlingService#handleError}.
 */
public record ErrorHandlingResult(String errorId,
                                  ErrorClassification classification,
                                  RecoveryApproach approach,
                                  RecoveryResult recoveryResult,
                                  long durationMs) {

    public boolean success() {
        return recoveryResult != null && recoveryResult.success();
    }
}
