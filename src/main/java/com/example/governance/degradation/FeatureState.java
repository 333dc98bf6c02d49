package com.example.governance.degradation;

import java.time.Instant;

public record FeatureState(String name,
                           boolean enabled,
                           int degradationLevel,
                           Instant lastUpdated,
                           boolean fallbackActive) {
}
