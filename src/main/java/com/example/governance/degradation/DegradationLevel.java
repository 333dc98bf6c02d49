package com.example.governance.degradation;

import java.util.List;
import java.util.Set;

public record DegradationLevel(int level,
                               String name,
                               String description,
                               Set<String> enabledFeatures,
                               Set<String> disabledFeatures,
                               PerformanceLimits performanceLimits,
                               List<FallbackStrategy> fallbackStrategies) {

    public DegradationLevel {
        enabledFeatures = enabledFeatures == null ? Set.of() : Set.copyOf(enabledFeatures);
        disabledFeatures = disabledFeatures == null ? Set.of() : Set.copyOf(disabledFeatures);
        fallbackStrategies = fallbackStrategies == null ? List.of() : List.copyOf(fallbackStrategies);
    }
}
