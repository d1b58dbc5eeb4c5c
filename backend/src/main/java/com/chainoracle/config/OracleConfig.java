package com.chainoracle.config;

import com.chainoracle.cache.TtlCache;
import com.chainoracle.health.HealthReporter;
import com.chainoracle.publish.ContractEventPublisher;
import com.chainoracle.resolver.CategoryResolver;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Cross-category beans: health reporting over every resolver and the simulated event publisher.
 */
@Configuration
public class OracleConfig {

    @Bean
    public HealthReporter healthReporter(List<CategoryResolver<?, ?, ?>> resolvers, TtlCache ttlCache,
                                         OracleProperties oracleProperties, Clock clock,
                                         @Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor fetchExecutor) {
        return new HealthReporter(resolvers, ttlCache, fetchExecutor,
                Duration.ofMillis(oracleProperties.getResolution().getHealthProbeTimeoutMs()), clock);
    }

    @Bean
    public ContractEventPublisher contractEventPublisher(TtlCache ttlCache, Clock clock) {
        return new ContractEventPublisher(ttlCache, clock);
    }
}
