package com.chainoracle.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cache and resolution settings. Documented in application.yml under chainoracle.
 */
@ConfigurationProperties(prefix = "chainoracle")
@Getter
@Setter
public class OracleProperties {

    private CacheProperties cache = new CacheProperties();

    private ResolutionProperties resolution = new ResolutionProperties();

    @Getter
    @Setter
    public static class CacheProperties {
        /** TTL for entries written without an explicit TTL (published events). */
        private int defaultTtlSeconds = 30;
        /** Interval of the background sweep that drops expired entries. */
        private long cleanupIntervalMs = 300_000;
    }

    @Getter
    @Setter
    public static class ResolutionProperties {
        /** Deadline for one resolution (whole fallback chain) when the caller gives none. */
        private long defaultTimeoutMs = 10_000;
        /** Per-adapter bound for health probes. */
        private long healthProbeTimeoutMs = 5_000;
        /** Max wait for a single upstream HTTP response. */
        private long upstreamTimeoutMs = 8_000;
    }
}
