package com.example.governance.recovery;

import com.example.governance.error.ErrorClassification;
import com.example.governance.error.ErrorSeverity;
import com.example.governance.error.ErrorType;
import lombok.Builder;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Named recovery policy. Immutable; registering another strategy with the same id replaces it.
 *
 * <p>{@code actions} is optional: when empty, the built-in action generator derives the
 * actions from the strategy id.</p>
 */
@Builder(toBuilder = true)
public record RecoveryStrategy(String strategyId,
                               String name,
                               String description,
                               Set<ErrorType> applicableErrorTypes,
                               Set<ErrorSeverity> applicableSeverities,
                               int priority,
                               int maxAttempts,
                               long timeoutMs,
                               SuccessCriteria successCriteria,
                               List<RecoveryPrerequisite> prerequisites,
                               RollbackStrategy rollbackStrategy,
                               long estimatedRecoveryTimeMs,
                               List<RecoveryAction> actions) {

    public RecoveryStrategy {
        Objects.requireNonNull(strategyId, "strategyId");
        name = name == null ? strategyId : name;
        applicableErrorTypes = applicableErrorTypes == null ? Set.of() : Set.copyOf(applicableErrorTypes);
        applicableSeverities = applicableSeverities == null ? Set.of() : Set.copyOf(applicableSeverities);
        successCriteria = successCriteria == null ? SuccessCriteria.healthCheck(false) : successCriteria;
        prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
        actions = actions == null ? List.of() : List.copyOf(actions);
        maxAttempts = Math.max(1, maxAttempts);
    }

    public boolean appliesTo(ErrorClassification classification) {
        return classification != null
                && applicableErrorTypes.contains(classification.errorType())
                && applicableSeverities.contains(classification.severity());
    }
}
