package com.chainoracle.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local key/value cache with per-entry TTL, backed by Caffeine variable expiration. Caffeine reads time
 * from the injected {@link Clock}, so an entry is absent from the moment its TTL elapses whether or not it has been
 * evicted yet. Writes are last-write-wins; no size cap.
 * <p>
 * Eviction of expired entries runs on Caffeine's timer wheel, so an entry that expired less than about a second
 * before a sweep may only be evicted by the next one. It still reads as absent.
 */
@Slf4j
public class TtlCache {

    private final Cache<String, Object> entries;
    private final Policy.VarExpiration<String, Object> expiration;
    private final AtomicLong expiredEvictions = new AtomicLong();
    private final Duration defaultTtl;

    public TtlCache(Duration defaultTtl) {
        this(defaultTtl, Clock.systemUTC());
    }

    public TtlCache(Duration defaultTtl, Clock clock) {
        requirePositive(defaultTtl);
        this.defaultTtl = defaultTtl;
        Instant origin = clock.instant();
        this.entries = Caffeine.newBuilder()
                .executor(Runnable::run)
                .ticker(() -> Duration.between(origin, clock.instant()).toNanos())
                .expireAfter(new DefaultTtlExpiry(defaultTtl))
                .removalListener((String key, Object value, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        expiredEvictions.incrementAndGet();
                    }
                })
                .build();
        this.expiration = entries.policy().expireVariably().orElseThrow();
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    /**
     * Typed read; a value of another type under the key counts as a miss.
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key).filter(type::isInstance).map(type::cast);
    }

    public void set(String key, Object value) {
        set(key, value, defaultTtl);
    }

    public void set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        requirePositive(ttl);
        expiration.put(key, value, ttl);
    }

    /**
     * Number of entries held after pending evictions have run. May include entries that expired within the last
     * timer tick.
     */
    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    /**
     * Runs Caffeine maintenance, evicting expired entries. An entry overwritten before its eviction is kept.
     *
     * @return number of expired entries evicted while the sweep ran
     */
    public long cleanup() {
        long before = expiredEvictions.get();
        entries.cleanUp();
        long removed = expiredEvictions.get() - before;
        log.debug("Cache cleanup removed {} expired entries, {} remain", removed, entries.estimatedSize());
        return removed;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * Writes through {@link Policy.VarExpiration#put} carry their own TTL; this covers any other write path. Reads
     * never extend an entry.
     */
    private static final class DefaultTtlExpiry implements Expiry<String, Object> {

        private final long ttlNanos;

        DefaultTtlExpiry(Duration ttl) {
            this.ttlNanos = ttl.toNanos();
        }

        @Override
        public long expireAfterCreate(String key, Object value, long currentTime) {
            return ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Object value, long currentTime, long currentDuration) {
            return ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Object value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
