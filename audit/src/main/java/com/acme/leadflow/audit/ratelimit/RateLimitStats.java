package com.acme.leadflow.audit.ratelimit;

import java.util.Map;

public record RateLimitStats(int activeKeys, long blockedTotal, Map<String, Integer> currentCounts) {
    public RateLimitStats {
        currentCounts = Map.copyOf(currentCounts);
    }
}
