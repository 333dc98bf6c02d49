package com.example.governance.degradation;

import java.util.Map;

/** Advisory limits published when a level is applied. */
public record PerformanceLimits(int maxConcurrentRequests,
                                long maxRequestSizeBytes,
                                long timeoutMs,
                                int rateLimitPerMinute) {

    public Map<String, Object> toAttributes() {
        return Map.of(
                "max_concurrent_requests", maxConcurrentRequests,
                "max_request_size", maxRequestSizeBytes,
                "timeout_ms", timeoutMs,
                "rate_limit_per_minute", rateLimitPerMinute);
    }
}
