package com.chainoracle.source.coinbase;

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
import java.util.Map;

/**
 * Live USD spot price via Coinbase /v2/prices/{SYMBOL}-USD/spot. Price only, no market data.
 */
public class CoinbasePriceAdapter extends HttpSourceSupport implements SourceAdapter<TokenQuery, TokenPrice> {

    public static final String PROVIDER = "coinbase";

    private final String baseUrl;
    private final Clock clock;

    public CoinbasePriceAdapter(String baseUrl, WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                Duration requestTimeout, Clock clock) {
        super(webClientBuilder, objectMapper, requestTimeout);
        this.baseUrl = baseUrl;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return PROVIDER;
    }

    @Override
    public TokenPrice fetch(TokenQuery query) {
        String body = getBody(baseUrl + "/v2/prices/" + query.symbol() + "-USD/spot", Map.of());
        return parse(readTree(body), query, clock.millis());
    }

    @Override
    public boolean isHealthy() {
        return probe(baseUrl + "/v2/time");
    }

    static TokenPrice parse(JsonNode root, TokenQuery query, long timestamp) {
        JsonNode data = root.path("data");
        if (!data.isObject()) {
            throw new UpstreamException(PROVIDER, "token " + query.symbol() + " not found");
        }
        String base = data.path("base").asText("");
        if (!base.isEmpty() && !base.equalsIgnoreCase(query.symbol())) {
            throw new UpstreamException(PROVIDER, "unexpected base " + base + " for " + query.symbol());
        }
        BigDecimal amount = decimalOrNull(data.path("amount"));
        if (amount == null || amount.signum() <= 0) {
            throw new UpstreamException(PROVIDER, "no USD price for " + query.symbol());
        }
        return TokenPrice.of(query.symbol(), amount, timestamp, PROVIDER);
    }
}
