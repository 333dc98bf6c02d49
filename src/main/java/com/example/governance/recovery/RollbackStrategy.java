package com.example.governance.recovery;

import java.util.List;

public record RollbackStrategy(String strategyId,
                               String description,
                               List<RecoveryAction> actions,
                               long timeoutMs) {

    public RollbackStrategy {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
