package com.chainoracle.resolver;

/**
 * Raw historical-price request; {@code date} is YYYY-MM-DD.
 */
public record HistoricalPriceRequest(String symbol, String date, String network) {
}
