package com.chainoracle.config;

import com.chainoracle.cache.TtlCache;
import com.chainoracle.common.RateLimiter;
import com.chainoracle.common.SymbolRegistry;
import com.chainoracle.domain.HistoricalPrice;
import com.chainoracle.domain.TokenPrice;
import com.chainoracle.resolver.HistoricalPriceResolver;
import com.chainoracle.resolver.TokenPriceResolver;
import com.chainoracle.source.HistoricalQuery;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.TokenQuery;
import com.chainoracle.source.coinbase.CoinbasePriceAdapter;
import com.chainoracle.source.coingecko.CoinGeckoHistoricalAdapter;
import com.chainoracle.source.coingecko.CoinGeckoPriceAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Token and historical price chains.
 * Token: keyed CoinGecko (only with an API key), public CoinGecko, Coinbase.
 * Historical: keyed CoinGecko (only with an API key), public CoinGecko.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PricingProperties.class)
public class PricingConfig {

    /** One bucket for every CoinGecko call, keyed or public. */
    @Bean
    public RateLimiter coingeckoRateLimiter(PricingProperties pricingProperties) {
        return new RateLimiter(pricingProperties.getCoingeckoRequestsPerMinute());
    }

    @Bean
    public SymbolRegistry symbolRegistry(PricingProperties pricingProperties) {
        return new SymbolRegistry(pricingProperties.getSymbolToCoinGeckoId());
    }

    @Bean
    public TokenPriceResolver tokenPriceResolver(PricingProperties pricing, OracleProperties oracle,
                                                 RateLimiter coingeckoRateLimiter, SymbolRegistry symbolRegistry,
                                                 TtlCache ttlCache, WebClient.Builder webClientBuilder,
                                                 ObjectMapper objectMapper, Clock clock,
                                                 @Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor fetchExecutor) {
        Duration upstreamTimeout = Duration.ofMillis(oracle.getResolution().getUpstreamTimeoutMs());
        List<SourceAdapter<TokenQuery, TokenPrice>> chain = new ArrayList<>();
        if (hasApiKey(pricing)) {
            chain.add(new CoinGeckoPriceAdapter(CoinGeckoPriceAdapter.KEYED_PROVIDER, pricing.getCoingeckoBaseUrl(),
                    pricing.getCoingeckoApiKey(), coingeckoRateLimiter, webClientBuilder, objectMapper,
                    upstreamTimeout, clock));
        } else {
            log.info("No CoinGecko API key configured; token prices start at the public tier");
        }
        chain.add(new CoinGeckoPriceAdapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, pricing.getCoingeckoBaseUrl(),
                null, coingeckoRateLimiter, webClientBuilder, objectMapper, upstreamTimeout, clock));
        chain.add(new CoinbasePriceAdapter(pricing.getCoinbaseBaseUrl(), webClientBuilder, objectMapper,
                upstreamTimeout, clock));
        return new TokenPriceResolver(chain, symbolRegistry, ttlCache, fetchExecutor,
                Duration.ofMillis(oracle.getResolution().getDefaultTimeoutMs()),
                Duration.ofSeconds(pricing.getTokenPriceTtlSeconds()));
    }

    @Bean
    public HistoricalPriceResolver historicalPriceResolver(PricingProperties pricing, OracleProperties oracle,
                                                           RateLimiter coingeckoRateLimiter,
                                                           SymbolRegistry symbolRegistry, TtlCache ttlCache,
                                                           WebClient.Builder webClientBuilder,
                                                           ObjectMapper objectMapper,
                                                           @Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor fetchExecutor) {
        Duration upstreamTimeout = Duration.ofMillis(oracle.getResolution().getUpstreamTimeoutMs());
        List<SourceAdapter<HistoricalQuery, HistoricalPrice>> chain = new ArrayList<>();
        if (hasApiKey(pricing)) {
            chain.add(new CoinGeckoHistoricalAdapter(CoinGeckoPriceAdapter.KEYED_PROVIDER,
                    pricing.getCoingeckoBaseUrl(), pricing.getCoingeckoApiKey(), coingeckoRateLimiter,
                    webClientBuilder, objectMapper, upstreamTimeout));
        }
        chain.add(new CoinGeckoHistoricalAdapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, pricing.getCoingeckoBaseUrl(),
                null, coingeckoRateLimiter, webClientBuilder, objectMapper, upstreamTimeout));
        return new HistoricalPriceResolver(chain, symbolRegistry, ttlCache, fetchExecutor,
                Duration.ofMillis(oracle.getResolution().getDefaultTimeoutMs()),
                Duration.ofHours(pricing.getHistoricalPriceTtlHours()));
    }

    private static boolean hasApiKey(PricingProperties pricing) {
        return pricing.getCoingeckoApiKey() != null && !pricing.getCoingeckoApiKey().isBlank();
    }
}
