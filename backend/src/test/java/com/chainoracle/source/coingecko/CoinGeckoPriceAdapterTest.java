package com.chainoracle.source.coingecko;

import com.chainoracle.common.RateLimiter;
import com.chainoracle.domain.Network;
import com.chainoracle.domain.TokenPrice;
import com.chainoracle.source.TokenQuery;
import com.chainoracle.source.UpstreamException;
import com.chainoracle.support.MutableClock;
import com.chainoracle.support.StubHttp;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoinGeckoPriceAdapterTest {

    private static final String BASE_URL = "https://api.coingecko.com/api/v3";
    private static final TokenQuery ETH = new TokenQuery("ETH", "ethereum", Network.POLYGON);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final MutableClock clock = MutableClock.atEpochMillis(1_700_000_000_000L);

    @Test
    @DisplayName("keyed tier sends the API key and reads market data")
    void keyedTier() {
        StubHttp http = StubHttp.ok("""
                {"ethereum": {"usd": 3500.25, "usd_market_cap": 420000000000, "usd_24h_vol": 15000000000,
                              "usd_24h_change": -1.5}}
                """);
        CoinGeckoPriceAdapter adapter = adapter(CoinGeckoPriceAdapter.KEYED_PROVIDER, "demo-key", http);

        TokenPrice price = adapter.fetch(ETH);

        assertThat(price.symbol()).isEqualTo("ETH");
        assertThat(price.priceUsd()).isEqualByComparingTo("3500.25");
        assertThat(price.price()).isEqualByComparingTo("3500.25");
        assertThat(price.marketCap()).isEqualByComparingTo("420000000000");
        assertThat(price.volume24h()).isEqualByComparingTo("15000000000");
        assertThat(price.percentChange24h()).isEqualByComparingTo("-1.5");
        assertThat(price.source()).isEqualTo("coingecko");
        assertThat(price.timestamp()).isEqualTo(1_700_000_000_000L);

        String url = http.lastRequest().url().toString();
        assertThat(url).contains("/simple/price?ids=ethereum&vs_currencies=usd").contains("include_market_cap=true");
        assertThat(http.lastRequest().headers().getFirst("x-cg-demo-api-key")).isEqualTo("demo-key");
    }

    @Test
    @DisplayName("public tier asks for the price only and sends no key")
    void publicTier() {
        StubHttp http = StubHttp.ok("{\"ethereum\": {\"usd\": 3500}}");
        CoinGeckoPriceAdapter adapter = adapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, null, http);

        TokenPrice price = adapter.fetch(ETH);

        assertThat(price.source()).isEqualTo("coingecko-public");
        assertThat(price.marketCap()).isNull();
        assertThat(http.lastRequest().url().toString()).doesNotContain("include_market_cap");
        assertThat(http.lastRequest().headers().containsKey("x-cg-demo-api-key")).isFalse();
    }

    @Test
    @DisplayName("unknown coin is an upstream failure")
    void unknownCoin() {
        CoinGeckoPriceAdapter adapter = adapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, null, StubHttp.ok("{}"));

        assertThatThrownBy(() -> adapter.fetch(ETH))
                .isInstanceOfSatisfying(UpstreamException.class, e -> {
                    assertThat(e.getProvider()).isEqualTo("coingecko-public");
                    assertThat(e.getMessage()).contains("not found");
                });
    }

    @Test
    @DisplayName("zero price is an upstream failure, not a record")
    void zeroPrice() {
        CoinGeckoPriceAdapter adapter = adapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, null,
                StubHttp.ok("{\"ethereum\": {\"usd\": 0}}"));

        assertThatThrownBy(() -> adapter.fetch(ETH)).isInstanceOf(UpstreamException.class);
    }

    @Test
    @DisplayName("non-2xx status is an upstream failure naming the status")
    void httpError() {
        CoinGeckoPriceAdapter adapter = adapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, null,
                StubHttp.status(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> adapter.fetch(ETH))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("429");
    }

    @Test
    @DisplayName("malformed JSON is an upstream failure")
    void malformedJson() {
        CoinGeckoPriceAdapter adapter = adapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, null, StubHttp.ok("<html>"));

        assertThatThrownBy(() -> adapter.fetch(ETH)).isInstanceOf(UpstreamException.class);
    }

    @Test
    @DisplayName("exhausted local rate limit fails without calling upstream")
    void rateLimited() {
        StubHttp http = StubHttp.ok("{\"ethereum\": {\"usd\": 1}}");
        RateLimiter limiter = new RateLimiter(1);
        limiter.tryAcquire();
        CoinGeckoPriceAdapter adapter = new CoinGeckoPriceAdapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, BASE_URL,
                null, limiter, http.builder(), objectMapper, Duration.ofMillis(100), clock);

        assertThatThrownBy(() -> adapter.fetch(ETH))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("rate limit");
        assertThat(http.requests()).isEmpty();
    }

    @Test
    @DisplayName("health probe hits /ping and reflects the status")
    void healthProbe() {
        StubHttp http = StubHttp.ok("{\"gecko_says\": \"(V3) To the Moon!\"}");
        CoinGeckoPriceAdapter adapter = adapter(CoinGeckoPriceAdapter.PUBLIC_PROVIDER, null, http);

        assertThat(adapter.isHealthy()).isTrue();
        assertThat(http.lastRequest().url().toString()).isEqualTo(BASE_URL + "/ping");

        http.respond(HttpStatus.SERVICE_UNAVAILABLE, "");
        assertThat(adapter.isHealthy()).isFalse();
    }

    private CoinGeckoPriceAdapter adapter(String providerId, String apiKey, StubHttp http) {
        return new CoinGeckoPriceAdapter(providerId, BASE_URL, apiKey, new RateLimiter(6_000), http.builder(),
                objectMapper, Duration.ofSeconds(2), clock);
    }
}
