package com.example.governance.degradation;

import java.time.Instant;

public record LevelChange(Instant timestamp, int fromLevel, int toLevel) {

    public boolean escalation() {
        return toLevel > fromLevel;
    }
}
