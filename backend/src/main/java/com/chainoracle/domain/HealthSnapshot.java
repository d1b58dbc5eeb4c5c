package com.chainoracle.domain;

import java.util.Map;

/**
 * Point-in-time liveness of every provider and category plus cache occupancy. Never cached.
 */
public record HealthSnapshot(
        Map<String, Boolean> providers,
        Map<String, Boolean> categories,
        long cacheSize,
        long generatedAt
) {

    public boolean allHealthy() {
        return providers.values().stream().allMatch(Boolean::booleanValue);
    }
}
