package com.chainoracle.cache;

import java.util.Objects;

/**
 * Builds cache keys as {@code discriminator:param1:param2...}. Separator and escape characters inside a part are
 * escaped, so distinct part lists never produce the same key.
 */
public final class CacheKeys {

    public static final char SEPARATOR = ':';
    private static final char ESCAPE = '\\';

    private CacheKeys() {}

    public static String build(String discriminator, Object... params) {
        StringBuilder key = new StringBuilder();
        appendEscaped(key, Objects.requireNonNull(discriminator, "discriminator"));
        for (Object param : params) {
            key.append(SEPARATOR);
            appendEscaped(key, String.valueOf(Objects.requireNonNull(param, "cache key part")));
        }
        return key.toString();
    }

    private static void appendEscaped(StringBuilder key, String part) {
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == SEPARATOR || c == ESCAPE) {
                key.append(ESCAPE);
            }
            key.append(c);
        }
    }
}
