package com.chainoracle.source;

import com.chainoracle.domain.Network;

/**
 * Normalized live-price query: upper-case ticker plus its CoinGecko id.
 */
public record TokenQuery(String symbol, String coinGeckoId, Network network) {
}
