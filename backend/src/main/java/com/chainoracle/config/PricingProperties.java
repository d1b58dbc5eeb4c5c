package com.chainoracle.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Token and historical price providers. Documented in application.yml under chainoracle.pricing.
 */
@ConfigurationProperties(prefix = "chainoracle.pricing")
@Getter
@Setter
public class PricingProperties {

    /**
     * CoinGecko API base URL (free: https://api.coingecko.com/api/v3).
     */
    private String coingeckoBaseUrl = "https://api.coingecko.com/api/v3";

    /**
     * CoinGecko demo API key. When set, the keyed CoinGecko tier heads the token and historical chains.
     */
    private String coingeckoApiKey;

    /**
     * Token bucket shared by every CoinGecko call.
     */
    private int coingeckoRequestsPerMinute = 30;

    /**
     * Coinbase API base URL; last tier of the token price chain.
     */
    private String coinbaseBaseUrl = "https://api.coinbase.com";

    private int tokenPriceTtlSeconds = 30;

    private int historicalPriceTtlHours = 24;

    /**
     * Ticker -> CoinGecko coin id, on top of the built-in map (BTC, ETH, MATIC, POL, USDC, USDT, DAI, LINK, UNI, AAVE).
     */
    private Map<String, String> symbolToCoinGeckoId = new HashMap<>();
}
