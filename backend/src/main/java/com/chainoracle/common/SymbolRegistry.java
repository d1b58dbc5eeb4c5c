package com.chainoracle.common;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps token tickers to CoinGecko coin ids. Built-in entries cover the common tickers; configured overrides win.
 * Tickers without an entry fall back to their lower-cased form, which is CoinGecko's id for many coins.
 */
public class SymbolRegistry {

    private static final Map<String, String> WELL_KNOWN_IDS = Map.of(
            "BTC", "bitcoin",
            "ETH", "ethereum",
            "MATIC", "matic-network",
            "POL", "polygon-ecosystem-token",
            "USDC", "usd-coin",
            "USDT", "tether",
            "DAI", "dai",
            "LINK", "chainlink",
            "UNI", "uniswap",
            "AAVE", "aave"
    );

    private final Map<String, String> coinGeckoIds;

    public SymbolRegistry() {
        this(Map.of());
    }

    /**
     * @param overrides ticker (any case) to CoinGecko id
     */
    public SymbolRegistry(Map<String, String> overrides) {
        Map<String, String> ids = new HashMap<>(WELL_KNOWN_IDS);
        if (overrides != null) {
            overrides.forEach((ticker, id) -> {
                if (ticker != null && id != null && !id.isBlank()) {
                    ids.put(ticker.strip().toUpperCase(Locale.ROOT), id.strip());
                }
            });
        }
        this.coinGeckoIds = Map.copyOf(ids);
    }

    /**
     * Upper-cased, stripped ticker; empty for null or blank input.
     */
    public static Optional<String> normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(symbol.strip().toUpperCase(Locale.ROOT));
    }

    /**
     * CoinGecko id for an already normalized ticker.
     */
    public String coinGeckoId(String normalizedSymbol) {
        return coinGeckoIds.getOrDefault(normalizedSymbol, normalizedSymbol.toLowerCase(Locale.ROOT));
    }
}
