package com.chainoracle.resolver;

import com.chainoracle.cache.TtlCache;
import com.chainoracle.domain.Category;
import com.chainoracle.domain.Resolved;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.UpstreamException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cache-then-fallback resolution for one category.
 * <p>
 * Flow: normalize the raw request (validation errors surface here, before any I/O), look up the category's cache
 * key, and on a miss try each adapter of the chain strictly in order. The first success is written to the cache with
 * the category TTL and returned; failures are collected so the final {@link ResolutionException} names every
 * provider attempted. The caller's timeout bounds the whole walk; on expiry the in-flight call is cancelled and
 * nothing is cached.
 *
 * @param <P> raw request
 * @param <Q> normalized query handed to adapters
 * @param <R> canonical record
 */
@Slf4j
public abstract class CategoryResolver<P, Q, R> {

    private final Category category;
    private final Class<R> recordType;
    private final TtlCache cache;
    private final Executor executor;
    private final Duration defaultTimeout;

    protected CategoryResolver(Category category, Class<R> recordType, TtlCache cache, Executor executor,
                               Duration defaultTimeout) {
        this.category = category;
        this.recordType = recordType;
        this.cache = cache;
        this.executor = executor;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Validates and normalizes the raw request.
     *
     * @throws com.chainoracle.common.RequestValidationException on malformed or unsupported input
     */
    protected abstract Q normalize(P request);

    public abstract String cacheKey(Q query);

    public abstract Duration ttl();

    /**
     * Fallback chain for the query, in preference order.
     */
    protected abstract List<SourceAdapter<Q, R>> chainFor(Q query);

    /**
     * Every adapter this resolver may use, for health reporting.
     */
    public abstract List<SourceAdapter<Q, R>> adapters();

    public Category getCategory() {
        return category;
    }

    public Resolved<R> resolve(P request) {
        return resolve(request, defaultTimeout);
    }

    public Resolved<R> resolve(P request, Duration timeout) {
        Q query = normalize(request);
        String key = cacheKey(query);
        var hit = cache.get(key, recordType);
        if (hit.isPresent()) {
            log.debug("Cache hit {}", key);
            return Resolved.fromCache(hit.get());
        }

        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        List<String> attempted = new ArrayList<>();
        UpstreamException lastFailure = null;
        for (SourceAdapter<Q, R> adapter : chainFor(query)) {
            long remainingNanos = deadlineNanos - System.nanoTime();
            if (remainingNanos <= 0) {
                throw new ResolutionTimeoutException(category, timeout, attempted);
            }
            attempted.add(adapter.providerId());
            try {
                R record = fetchWithin(adapter, query, remainingNanos, timeout, attempted);
                cache.set(key, record, ttl());
                log.info("Resolved {} via {}", key, adapter.providerId());
                return Resolved.fresh(record);
            } catch (UpstreamException e) {
                log.warn("{} failed for {}: {}", adapter.providerId(), key, e.getMessage());
                lastFailure = e;
            }
        }
        throw new ResolutionException(category, attempted, lastFailure);
    }

    private R fetchWithin(SourceAdapter<Q, R> adapter, Q query, long remainingNanos, Duration timeout,
                          List<String> attempted) {
        CompletableFuture<R> call;
        try {
            call = CompletableFuture.supplyAsync(() -> adapter.fetch(query), executor);
        } catch (RejectedExecutionException e) {
            throw new UpstreamException(adapter.providerId(), "fetch rejected by executor: " + e.getMessage(), e);
        }
        try {
            R record = call.get(remainingNanos, TimeUnit.NANOSECONDS);
            if (record == null) {
                throw new UpstreamException(adapter.providerId(), "adapter returned no record");
            }
            return record;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ResolutionTimeoutException(category, timeout, attempted);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new ResolutionTimeoutException(category, timeout, attempted);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UpstreamException upstream) {
                throw upstream;
            }
            throw new UpstreamException(adapter.providerId(), "unexpected failure: " + cause, cause);
        }
    }
}
