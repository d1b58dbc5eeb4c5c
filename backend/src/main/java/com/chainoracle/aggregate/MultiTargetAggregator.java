package com.chainoracle.aggregate;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Resolves the same category for several targets concurrently. Each target is its own failure domain: a failed
 * target is logged and left out of the result, never cancelling the others. The result therefore only holds the
 * targets that succeeded, in the order they were given.
 */
@Slf4j
public class MultiTargetAggregator {

    private final Executor executor;

    public MultiTargetAggregator(Executor executor) {
        this.executor = executor;
    }

    public <T, R> Map<T, R> resolveAll(Collection<T> targets, Function<T, R> resolver) {
        List<T> ordered = List.copyOf(targets);
        List<CompletableFuture<R>> futures = new ArrayList<>(ordered.size());
        for (T target : ordered) {
            futures.add(CompletableFuture.supplyAsync(() -> resolver.apply(target), executor)
                    .exceptionally(e -> {
                        log.warn("Target {} failed: {}", target, rootMessage(e));
                        return null;
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        Map<T, R> results = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            R result = futures.get(i).join();
            if (result != null) {
                results.put(ordered.get(i), result);
            }
        }
        return Collections.unmodifiableMap(results);
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t != t.getCause()) {
            t = t.getCause();
        }
        return t.getMessage();
    }
}
