package com.chainoracle.domain;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * A resolved record plus whether it was served from cache. The flag is attached at return time and is
 * never part of the cached value; serializes as the record's fields plus {@code "cached"}.
 */
public record Resolved<T>(@JsonUnwrapped T data, boolean cached) {

    public static <T> Resolved<T> fresh(T data) {
        return new Resolved<>(data, false);
    }

    public static <T> Resolved<T> fromCache(T data) {
        return new Resolved<>(data, true);
    }
}
