package com.chainoracle.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Live USD price of a token as reported by one provider.
 * {@code price} mirrors {@code priceUsd}; dashboards read either.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenPrice(
        String symbol,
        BigDecimal price,
        BigDecimal priceUsd,
        long timestamp,
        String source,
        BigDecimal marketCap,
        BigDecimal volume24h,
        BigDecimal percentChange24h
) {

    public static TokenPrice of(String symbol, BigDecimal priceUsd, long timestamp, String source) {
        return new TokenPrice(symbol, priceUsd, priceUsd, timestamp, source, null, null, null);
    }
}
