package com.chainoracle.source.coingecko;

import java.util.Map;

final class CoinGeckoHeaders {

    static final String DEMO_API_KEY_HEADER = "x-cg-demo-api-key";

    private CoinGeckoHeaders() {}

    static Map<String, String> apiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            return Map.of();
        }
        return Map.of(DEMO_API_KEY_HEADER, apiKey);
    }
}
