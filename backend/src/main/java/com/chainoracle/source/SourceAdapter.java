package com.chainoracle.source;

/**
 * One upstream provider for one category. Performs exactly one upstream call per {@link #fetch}; retry and
 * fallback belong to the resolver that owns the chain.
 *
 * @param <Q> normalized query
 * @param <R> canonical record
 */
public interface SourceAdapter<Q, R> {

    /**
     * Stable provider id, reported in records, errors and health snapshots (e.g. "coingecko-public").
     */
    String providerId();

    /**
     * @throws UpstreamException on non-success status, unexpected payload, or when the requested entity is absent
     */
    R fetch(Q query);

    /**
     * Cheap liveness probe, separate from the fetch path. Never throws.
     */
    boolean isHealthy();
}
