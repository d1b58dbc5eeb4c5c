package com.chainoracle.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep of expired cache entries, independent of request traffic.
 */
@Component
@RequiredArgsConstructor
public class CacheCleanupJob {

    private final TtlCache ttlCache;

    @Scheduled(
            fixedRateString = "${chainoracle.cache.cleanup-interval-ms:300000}",
            initialDelayString = "${chainoracle.cache.cleanup-interval-ms:300000}")
    public void runScheduled() {
        ttlCache.cleanup();
    }
}
