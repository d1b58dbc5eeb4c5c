package com.chainoracle.domain;

/**
 * Class of requestable fact. The key prefix doubles as the cache-key discriminator.
 */
public enum Category {
    TOKEN_PRICE("token_price"),
    GAS_PRICE("gas_price"),
    HISTORICAL_PRICE("historical_price"),
    CONTRACT_EVENT("contract_event");

    private final String keyPrefix;

    Category(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String keyPrefix() {
        return keyPrefix;
    }

    @Override
    public String toString() {
        return keyPrefix;
    }
}
