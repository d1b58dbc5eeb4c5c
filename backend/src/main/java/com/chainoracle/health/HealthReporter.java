package com.chainoracle.health;

import com.chainoracle.cache.TtlCache;
import com.chainoracle.domain.HealthSnapshot;
import com.chainoracle.resolver.CategoryResolver;
import com.chainoracle.source.SourceAdapter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Probes every registered adapter concurrently and reports provider and category liveness plus cache size.
 * A probe that throws or outlives the probe timeout counts as unhealthy; it never affects the other probes.
 * A provider id shared by several adapters is healthy only if all of them are; a category is healthy if any
 * adapter in its chain is.
 */
@Slf4j
public class HealthReporter {

    private final List<CategoryResolver<?, ?, ?>> resolvers;
    private final TtlCache cache;
    private final Executor executor;
    private final Duration probeTimeout;
    private final Clock clock;

    public HealthReporter(List<CategoryResolver<?, ?, ?>> resolvers, TtlCache cache, Executor executor,
                          Duration probeTimeout, Clock clock) {
        this.resolvers = List.copyOf(resolvers);
        this.cache = cache;
        this.executor = executor;
        this.probeTimeout = probeTimeout;
        this.clock = clock;
    }

    public HealthSnapshot snapshot() {
        List<Probe> probes = new ArrayList<>();
        for (CategoryResolver<?, ?, ?> resolver : resolvers) {
            for (SourceAdapter<?, ?> adapter : resolver.adapters()) {
                probes.add(new Probe(resolver.getCategory().keyPrefix(), adapter.providerId(), probe(adapter)));
            }
        }
        CompletableFuture.allOf(probes.stream().map(Probe::result).toArray(CompletableFuture[]::new)).join();

        Map<String, Boolean> providers = new LinkedHashMap<>();
        Map<String, Boolean> categories = new LinkedHashMap<>();
        for (Probe probe : probes) {
            boolean healthy = probe.result().join();
            providers.merge(probe.provider(), healthy, Boolean::logicalAnd);
            categories.merge(probe.category(), healthy, Boolean::logicalOr);
        }
        return new HealthSnapshot(providers, categories, cache.size(), clock.millis());
    }

    private CompletableFuture<Boolean> probe(SourceAdapter<?, ?> adapter) {
        CompletableFuture<Boolean> submitted;
        try {
            submitted = CompletableFuture.supplyAsync(adapter::isHealthy, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Health probe for {} rejected by executor: {}", adapter.providerId(), e.getMessage());
            return CompletableFuture.completedFuture(false);
        }
        return submitted
                .completeOnTimeout(false, probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warn("Health probe for {} threw: {}", adapter.providerId(), e.getMessage());
                    return false;
                });
    }

    private record Probe(String category, String provider, CompletableFuture<Boolean> result) {}
}
