package com.example.governance.recovery;

import com.example.governance.error.ErrorContext;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Guard evaluated before any recovery action runs. A validator that does not answer within
 * {@code timeoutMs} counts as failed.
 */
public record RecoveryPrerequisite(PrerequisiteType type,
                                   String description,
                                   Function<ErrorContext, CompletableFuture<Boolean>> validator,
                                   long timeoutMs) {

    public RecoveryPrerequisite {
        Objects.requireNonNull(validator, "validator");
        type = type == null ? PrerequisiteType.SYSTEM_CHECK : type;
        timeoutMs = timeoutMs <= 0 ? 5000L : timeoutMs;
    }
}
