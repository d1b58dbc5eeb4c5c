package com.chainoracle.source.coingecko;

import com.chainoracle.common.RateLimiter;
import com.chainoracle.domain.TokenPrice;
import com.chainoracle.source.HttpSourceSupport;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.TokenQuery;
import com.chainoracle.source.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Live USD price via CoinGecko /simple/price. The keyed tier sends the demo API key header and asks for market cap,
 * 24h volume and 24h change; the public tier asks for the price only.
 */
public class CoinGeckoPriceAdapter extends HttpSourceSupport implements SourceAdapter<TokenQuery, TokenPrice> {

    public static final String KEYED_PROVIDER = "coingecko";
    public static final String PUBLIC_PROVIDER = "coingecko-public";

    private final String providerId;
    private final String baseUrl;
    private final String apiKey;
    private final RateLimiter rateLimiter;
    private final Clock clock;

    public CoinGeckoPriceAdapter(String providerId, String baseUrl, String apiKey, RateLimiter rateLimiter,
                                 WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                 Duration requestTimeout, Clock clock) {
        super(webClientBuilder, objectMapper, requestTimeout);
        this.providerId = providerId;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public TokenPrice fetch(TokenQuery query) {
        if (!rateLimiter.tryAcquire(requestTimeout)) {
            throw new UpstreamException(providerId, "local rate limit exhausted");
        }
        String url = baseUrl + "/simple/price?ids=" + query.coinGeckoId() + "&vs_currencies=usd";
        if (isKeyed()) {
            url += "&include_market_cap=true&include_24hr_vol=true&include_24hr_change=true";
        }
        String body = getBody(url, CoinGeckoHeaders.apiKey(apiKey));
        return parse(readTree(body), query, providerId, clock.millis());
    }

    @Override
    public boolean isHealthy() {
        return probe(baseUrl + "/ping");
    }

    private boolean isKeyed() {
        return apiKey != null && !apiKey.isBlank();
    }

    static TokenPrice parse(JsonNode root, TokenQuery query, String providerId, long timestamp) {
        JsonNode coin = root.path(query.coinGeckoId());
        if (coin.isMissingNode() || !coin.isObject()) {
            throw new UpstreamException(providerId, "token " + query.symbol() + " not found");
        }
        BigDecimal usd = decimalOrNull(coin.path("usd"));
        if (usd == null || usd.signum() <= 0) {
            throw new UpstreamException(providerId, "no USD price for " + query.symbol());
        }
        return new TokenPrice(
                query.symbol(),
                usd,
                usd,
                timestamp,
                providerId,
                decimalOrNull(coin.path("usd_market_cap")),
                decimalOrNull(coin.path("usd_24h_vol")),
                decimalOrNull(coin.path("usd_24h_change")));
    }
}
