package com.example.governance.store;

import com.example.governance.error.ErrorSeverity;
import com.example.governance.error.ErrorType;
import com.example.governance.recovery.RecoveryStrategy;

import java.util.List;

/** {@code recovery_strategies} row. */
public record RecoveryStrategyRow(String strategyId,
                                  String name,
                                  String description,
                                  List<String> applicableErrorTypes,
                                  List<String> applicableSeverities,
                                  int priority,
                                  int maxAttempts,
                                  long timeoutMs,
                                  long estimatedRecoveryTimeMs) {

    public static RecoveryStrategyRow from(RecoveryStrategy s) {
        return new RecoveryStrategyRow(
                s.strategyId(),
                s.name(),
                s.description(),
                s.applicableErrorTypes().stream().map(ErrorType::code).sorted().toList(),
                s.applicableSeverities().stream().sorted().map(ErrorSeverity::code).toList(),
                s.priority(),
                s.maxAttempts(),
                s.timeoutMs(),
                s.estimatedRecoveryTimeMs());
    }
}
