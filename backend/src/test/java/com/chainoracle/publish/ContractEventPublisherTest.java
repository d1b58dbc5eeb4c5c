package com.chainoracle.publish;

import com.chainoracle.cache.TtlCache;
import com.chainoracle.common.RequestValidationException;
import com.chainoracle.domain.ContractEvent;
import com.chainoracle.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractEventPublisherTest {

    private static final String ADDRESS = "0xAbCdEf0123456789abcdef0123456789ABCDEF01";

    private MutableClock clock;
    private TtlCache cache;
    private ContractEventPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMillis(1_700_000_000_000L);
        cache = new TtlCache(Duration.ofSeconds(30), clock);
        publisher = new ContractEventPublisher(cache, clock, new Random(42));
    }

    @Test
    @DisplayName("publish returns a simulated receipt and caches the event")
    void publishCachesEvent() {
        Map<String, Object> data = Map.of("price", 3500.25, "tags", List.of("a", "b"));

        ContractEvent event = publisher.publish("PriceUpdated", ADDRESS, data);

        assertThat(event.eventName()).isEqualTo("PriceUpdated");
        assertThat(event.contractAddress()).isEqualTo(ADDRESS.toLowerCase());
        assertThat(event.data()).isEqualTo(data);
        assertThat(event.transactionHash()).matches("^0x[0-9a-f]{64}$");
        assertThat(event.blockNumber()).isBetween(50_000_000L, 50_999_999L);
        assertThat(event.timestamp()).isEqualTo(1_700_000_000_000L);

        String key = "contract_event:" + ADDRESS.toLowerCase() + ":PriceUpdated:1700000000000:" + event.transactionHash();
        assertThat(cache.get(key, ContractEvent.class)).contains(event);
    }

    @Test
    @DisplayName("published event lives for the cache default TTL")
    void eventExpiresWithDefaultTtl() {
        publisher.publish("Ping", ADDRESS, Map.of());
        assertThat(cache.size()).isEqualTo(1);
        clock.advance(Duration.ofSeconds(31));
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("payload is copied; later caller mutation does not leak in")
    void payloadCopied() {
        Map<String, Object> data = new HashMap<>();
        data.put("k", "v");

        ContractEvent event = publisher.publish("Ping", ADDRESS, data);
        data.put("k", "changed");

        assertThat(event.data()).containsEntry("k", "v");
    }

    @Test
    @DisplayName("two publishes in the same millisecond are both kept")
    void sameMillisecondDistinctEntries() {
        publisher.publish("Ping", ADDRESS, Map.of());
        publisher.publish("Ping", ADDRESS, Map.of());
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("invalid address, blank event name or missing data is rejected and nothing is cached")
    void validation() {
        assertThatThrownBy(() -> publisher.publish("Ping", "0x123", Map.of()))
                .isInstanceOfSatisfying(RequestValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(RequestValidationException.INVALID_ADDRESS));
        assertThatThrownBy(() -> publisher.publish("Ping", ADDRESS.substring(2), Map.of()))
                .isInstanceOf(RequestValidationException.class);
        assertThatThrownBy(() -> publisher.publish(" ", ADDRESS, Map.of()))
                .isInstanceOf(RequestValidationException.class);
        assertThatThrownBy(() -> publisher.publish("Ping", ADDRESS, null))
                .isInstanceOf(RequestValidationException.class);
        assertThat(cache.size()).isZero();
    }

    @Test
    void isValidContractAddress() {
        assertThat(ContractEventPublisher.isValidContractAddress(ADDRESS)).isTrue();
        assertThat(ContractEventPublisher.isValidContractAddress("0x" + "g".repeat(40))).isFalse();
        assertThat(ContractEventPublisher.isValidContractAddress(null)).isFalse();
    }
}
