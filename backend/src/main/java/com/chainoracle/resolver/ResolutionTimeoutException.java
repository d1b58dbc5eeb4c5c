package com.chainoracle.resolver;

import com.chainoracle.domain.Category;

import java.time.Duration;
import java.util.List;

/**
 * The caller's deadline passed before any adapter in the chain succeeded. Nothing was written to the cache.
 */
public class ResolutionTimeoutException extends RuntimeException {

    private final Category category;
    private final Duration timeout;
    private final List<String> attempted;

    public ResolutionTimeoutException(Category category, Duration timeout, List<String> attempted) {
        super("Timed out resolving " + category + " after " + timeout.toMillis() + " ms (attempted: "
                + String.join(", ", attempted) + ")");
        this.category = category;
        this.timeout = timeout;
        this.attempted = List.copyOf(attempted);
    }

    public Category getCategory() {
        return category;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public List<String> getAttempted() {
        return attempted;
    }
}
