package com.chainoracle.domain;

import java.math.BigDecimal;

/**
 * Gas price tiers for one network, in gwei. Tiers are passed through exactly as the provider reported them;
 * {@code standard <= fast <= instant} is expected of providers but not enforced here.
 */
public record GasPrice(
        String network,
        BigDecimal standard,
        BigDecimal fast,
        BigDecimal instant,
        long timestamp,
        String unit
) {

    public static final String GWEI = "gwei";

    public static GasPrice gwei(Network network, BigDecimal standard, BigDecimal fast, BigDecimal instant, long timestamp) {
        return new GasPrice(network.id(), standard, fast, instant, timestamp, GWEI);
    }
}
