package com.chainoracle.source.coingecko;

import com.chainoracle.common.RateLimiter;
import com.chainoracle.domain.HistoricalPrice;
import com.chainoracle.source.HistoricalQuery;
import com.chainoracle.source.HttpSourceSupport;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Historical USD price via CoinGecko /coins/{id}/history. Requires market_data.current_price.usd;
 * a missing total_volume.usd is reported as volume 0.
 */
public class CoinGeckoHistoricalAdapter extends HttpSourceSupport implements SourceAdapter<HistoricalQuery, HistoricalPrice> {

    static final DateTimeFormatter COINGECKO_DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    private final String providerId;
    private final String baseUrl;
    private final String apiKey;
    private final RateLimiter rateLimiter;

    public CoinGeckoHistoricalAdapter(String providerId, String baseUrl, String apiKey, RateLimiter rateLimiter,
                                      WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                      Duration requestTimeout) {
        super(webClientBuilder, objectMapper, requestTimeout);
        this.providerId = providerId;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public HistoricalPrice fetch(HistoricalQuery query) {
        if (!rateLimiter.tryAcquire(requestTimeout)) {
            throw new UpstreamException(providerId, "local rate limit exhausted");
        }
        String url = baseUrl + "/coins/" + query.coinGeckoId() + "/history?date="
                + query.date().format(COINGECKO_DATE) + "&localization=false";
        String body = getBody(url, CoinGeckoHeaders.apiKey(apiKey));
        return parse(readTree(body), query, providerId);
    }

    @Override
    public boolean isHealthy() {
        return probe(baseUrl + "/ping");
    }

    static HistoricalPrice parse(JsonNode root, HistoricalQuery query, String providerId) {
        JsonNode marketData = root.path("market_data");
        BigDecimal usd = decimalOrNull(marketData.path("current_price").path("usd"));
        if (usd == null || usd.signum() <= 0) {
            throw new UpstreamException(providerId,
                    "no historical data for " + query.symbol() + " on " + query.date());
        }
        BigDecimal volume = decimalOrNull(marketData.path("total_volume").path("usd"));
        return HistoricalPrice.of(query.symbol(), query.date(), usd, volume != null ? volume : BigDecimal.ZERO);
    }
}
