package com.chainoracle.config;

import com.chainoracle.cache.TtlCache;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * The single shared in-process cache and the clock its expiry is measured against.
 */
@Configuration
@EnableConfigurationProperties(OracleProperties.class)
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TtlCache ttlCache(OracleProperties properties, Clock clock) {
        return new TtlCache(Duration.ofSeconds(properties.getCache().getDefaultTtlSeconds()), clock);
    }
}
