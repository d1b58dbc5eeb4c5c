package com.chainoracle.resolver;

import com.chainoracle.domain.Category;

import java.util.List;

/**
 * Every adapter in a category's fallback chain failed. Lists the providers attempted, in chain order.
 */
public class ResolutionException extends RuntimeException {

    private final Category category;
    private final List<String> attempted;

    public ResolutionException(Category category, List<String> attempted, Throwable lastFailure) {
        super("Failed to resolve " + category + " (attempted: " + String.join(", ", attempted) + ")"
                + (lastFailure != null ? ": " + lastFailure.getMessage() : ""), lastFailure);
        this.category = category;
        this.attempted = List.copyOf(attempted);
    }

    public Category getCategory() {
        return category;
    }

    public List<String> getAttempted() {
        return attempted;
    }
}
