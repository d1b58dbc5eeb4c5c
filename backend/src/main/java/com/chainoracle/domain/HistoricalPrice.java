package com.chainoracle.domain;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * USD price of a token on a past calendar date. One record per (symbol, date).
 */
public record HistoricalPrice(
        String symbol,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd") LocalDate date,
        BigDecimal price,
        BigDecimal priceUsd,
        BigDecimal volume
) {

    public static HistoricalPrice of(String symbol, LocalDate date, BigDecimal priceUsd, BigDecimal volume) {
        return new HistoricalPrice(symbol, date, priceUsd, priceUsd, volume);
    }
}
