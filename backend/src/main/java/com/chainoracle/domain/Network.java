package com.chainoracle.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Blockchain network a request may target. The id is the lower-case wire name ("polygon", "ethereum").
 */
public enum Network {
    ETHEREUM("ethereum"),
    POLYGON("polygon"),
    BSC("bsc"),
    ARBITRUM("arbitrum"),
    OPTIMISM("optimism");

    private final String id;

    Network(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Case-insensitive lookup by wire id or enum name.
     */
    public static Optional<Network> fromId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(n -> n.id.equals(normalized))
                .findFirst();
    }
}
