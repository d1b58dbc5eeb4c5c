package com.chainoracle.source.coingecko;

import com.chainoracle.common.RateLimiter;
import com.chainoracle.domain.HistoricalPrice;
import com.chainoracle.domain.Network;
import com.chainoracle.source.HistoricalQuery;
import com.chainoracle.source.UpstreamException;
import com.chainoracle.support.StubHttp;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoinGeckoHistoricalAdapterTest {

    private static final HistoricalQuery BTC = new HistoricalQuery("BTC", "bitcoin", LocalDate.of(2024, 1, 5), Network.POLYGON);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("parse extracts usd from market_data.current_price and volume from total_volume")
    void parsePriceAndVolume() throws Exception {
        String json = """
                {
                  "market_data": {
                    "current_price": {
                      "usd": 42000.5,
                      "eur": 38000.2
                    },
                    "total_volume": {
                      "usd": 25000000000
                    }
                  }
                }
                """;
        HistoricalPrice price = CoinGeckoHistoricalAdapter.parse(objectMapper.readTree(json), BTC, "coingecko-public");

        assertThat(price.symbol()).isEqualTo("BTC");
        assertThat(price.date()).isEqualTo(LocalDate.of(2024, 1, 5));
        assertThat(price.priceUsd()).isEqualByComparingTo("42000.5");
        assertThat(price.price()).isEqualByComparingTo("42000.5");
        assertThat(price.volume()).isEqualByComparingTo("25000000000");
    }

    @Test
    @DisplayName("missing total_volume.usd reports volume 0")
    void missingVolumeIsZero() throws Exception {
        String json = "{\"market_data\": {\"current_price\": {\"usd\": 100}}}";
        HistoricalPrice price = CoinGeckoHistoricalAdapter.parse(objectMapper.readTree(json), BTC, "coingecko-public");
        assertThat(price.volume()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("missing usd or market_data is an upstream failure")
    void missingPrice() {
        assertThatThrownBy(() -> CoinGeckoHistoricalAdapter.parse(
                objectMapper.readTree("{\"market_data\": {\"current_price\": {}}}"), BTC, "coingecko-public"))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("no historical data");
        assertThatThrownBy(() -> CoinGeckoHistoricalAdapter.parse(objectMapper.readTree("{}"), BTC, "coingecko-public"))
                .isInstanceOf(UpstreamException.class);
    }

    @Test
    @DisplayName("fetch requests /coins/{id}/history with a DD-MM-YYYY date")
    void fetchUrl() {
        StubHttp http = StubHttp.ok("{\"market_data\": {\"current_price\": {\"usd\": 44000}}}");
        CoinGeckoHistoricalAdapter adapter = new CoinGeckoHistoricalAdapter(CoinGeckoPriceAdapter.KEYED_PROVIDER,
                "https://api.coingecko.com/api/v3", "demo-key", new RateLimiter(6_000), http.builder(),
                objectMapper, Duration.ofSeconds(2));

        HistoricalPrice price = adapter.fetch(BTC);

        assertThat(price.priceUsd()).isEqualByComparingTo("44000");
        assertThat(http.lastRequest().url().toString())
                .isEqualTo("https://api.coingecko.com/api/v3/coins/bitcoin/history?date=05-01-2024&localization=false");
        assertThat(http.lastRequest().headers().getFirst("x-cg-demo-api-key")).isEqualTo("demo-key");
        assertThat(adapter.providerId()).isEqualTo("coingecko");
    }
}
