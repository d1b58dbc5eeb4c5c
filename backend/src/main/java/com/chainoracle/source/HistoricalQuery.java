package com.chainoracle.source;

import com.chainoracle.domain.Network;

import java.time.LocalDate;

/**
 * Normalized historical-price query for one calendar date.
 */
public record HistoricalQuery(String symbol, String coinGeckoId, LocalDate date, Network network) {
}
