package com.example.governance.coordination;

import java.util.List;

public record PhaseDependency(String phaseId, List<String> dependsOn, Type type) {

    public PhaseDependency {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        type = type == null ? Type.SEQUENTIAL : type;
    }

    public enum Type {
        SEQUENTIAL,
        PARALLEL,
        CONDITIONAL
    }
}
