package com.chainoracle.resolver;

import com.chainoracle.cache.TtlCache;
import com.chainoracle.common.RequestValidationException;
import com.chainoracle.common.SymbolRegistry;
import com.chainoracle.domain.Network;
import com.chainoracle.domain.Resolved;
import com.chainoracle.domain.TokenPrice;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.TokenQuery;
import com.chainoracle.source.UpstreamException;
import com.chainoracle.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenPriceResolverTest {

    @Mock
    SourceAdapter<TokenQuery, TokenPrice> primary;
    @Mock
    SourceAdapter<TokenQuery, TokenPrice> secondary;

    private ExecutorService executor;
    private TtlCache cache;
    private TokenPriceResolver resolver;

    @BeforeEach
    void setUp() {
        lenient().when(primary.providerId()).thenReturn("primary");
        lenient().when(secondary.providerId()).thenReturn("secondary");
        executor = Executors.newCachedThreadPool();
        cache = new TtlCache(Duration.ofSeconds(30), MutableClock.atEpochMillis(1_700_000_000_000L));
        resolver = new TokenPriceResolver(List.of(primary, secondary), new SymbolRegistry(), cache, executor,
                Duration.ofSeconds(5), Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("first adapter success is returned and cached; later adapters are not called")
    void firstSuccessWins() {
        when(primary.fetch(any())).thenReturn(price("ETH", "3500.25", "primary"));

        Resolved<TokenPrice> result = resolver.resolve(new TokenPriceRequest("ETH", "polygon"));

        assertThat(result.cached()).isFalse();
        assertThat(result.data().priceUsd()).isEqualByComparingTo("3500.25");
        assertThat(result.data().source()).isEqualTo("primary");
        assertThat(cache.get("token_price:ETH:polygon", TokenPrice.class)).isPresent();
        verify(secondary, never()).fetch(any());
    }

    @Test
    @DisplayName("falls back to the next adapter when the first fails")
    void fallsBackInOrder() {
        when(primary.fetch(any())).thenThrow(new UpstreamException("primary", "HTTP 429"));
        when(secondary.fetch(any())).thenReturn(price("ETH", "3499", "secondary"));

        Resolved<TokenPrice> result = resolver.resolve(new TokenPriceRequest("ETH", null));

        assertThat(result.data().source()).isEqualTo("secondary");
        verify(primary).fetch(any());
        verify(secondary).fetch(any());
    }

    @Test
    @DisplayName("unexpected adapter exception counts as a failed tier")
    void unexpectedExceptionFallsBack() {
        when(primary.fetch(any())).thenThrow(new IllegalStateException("boom"));
        when(secondary.fetch(any())).thenReturn(price("ETH", "3499", "secondary"));

        assertThat(resolver.resolve(new TokenPriceRequest("ETH", null)).data().source()).isEqualTo("secondary");
    }

    @Test
    @DisplayName("all adapters failing raises ResolutionException naming every provider and caches nothing")
    void allFail() {
        when(primary.fetch(any())).thenThrow(new UpstreamException("primary", "HTTP 500"));
        when(secondary.fetch(any())).thenThrow(new UpstreamException("secondary", "token ZZZ not found"));

        assertThatThrownBy(() -> resolver.resolve(new TokenPriceRequest("ZZZ", "polygon")))
                .isInstanceOfSatisfying(ResolutionException.class, e -> {
                    assertThat(e.getAttempted()).containsExactly("primary", "secondary");
                    assertThat(e.getMessage()).contains("primary").contains("secondary");
                    assertThat(e.getCategory().keyPrefix()).isEqualTo("token_price");
                });
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("second request within TTL is served from cache without upstream calls")
    void cacheHit() {
        when(primary.fetch(any())).thenReturn(price("ETH", "3500", "primary"));

        Resolved<TokenPrice> first = resolver.resolve(new TokenPriceRequest("eth", "polygon"));
        Resolved<TokenPrice> second = resolver.resolve(new TokenPriceRequest("ETH", "POLYGON"));

        assertThat(first.cached()).isFalse();
        assertThat(second.cached()).isTrue();
        assertThat(second.data()).isEqualTo(first.data());
        verify(primary, times(1)).fetch(any());
    }

    @Test
    @DisplayName("same symbol on different networks uses distinct cache entries")
    void networkIsPartOfKey() {
        when(primary.fetch(any())).thenReturn(price("ETH", "3500", "primary"));

        resolver.resolve(new TokenPriceRequest("ETH", "polygon"));
        Resolved<TokenPrice> other = resolver.resolve(new TokenPriceRequest("ETH", "ethereum"));

        assertThat(other.cached()).isFalse();
        verify(primary, times(2)).fetch(any());
    }

    @Test
    @DisplayName("symbol is normalized and mapped to its CoinGecko id; network defaults to polygon")
    void normalizesQuery() {
        when(primary.fetch(any())).thenReturn(price("MATIC", "0.5", "primary"));

        resolver.resolve(new TokenPriceRequest("  matic ", null));

        ArgumentCaptor<TokenQuery> query = ArgumentCaptor.forClass(TokenQuery.class);
        verify(primary).fetch(query.capture());
        assertThat(query.getValue()).isEqualTo(new TokenQuery("MATIC", "matic-network", Network.POLYGON));
    }

    @Test
    @DisplayName("invalid input is rejected before any adapter is called")
    void validationBeforeIo() {
        assertThatThrownBy(() -> resolver.resolve(new TokenPriceRequest("", "polygon")))
                .isInstanceOf(RequestValidationException.class);
        assertThatThrownBy(() -> resolver.resolve(new TokenPriceRequest("E T H", "polygon")))
                .isInstanceOf(RequestValidationException.class);
        assertThatThrownBy(() -> resolver.resolve(new TokenPriceRequest("ETH", "solana")))
                .isInstanceOfSatisfying(RequestValidationException.class,
                        e -> assertThat(e.getCode()).isEqualTo(RequestValidationException.INVALID_NETWORK));
        verify(primary, never()).fetch(any());
        verify(secondary, never()).fetch(any());
    }

    @Test
    @DisplayName("deadline expiry raises ResolutionTimeoutException and caches nothing")
    void timeout() {
        when(primary.fetch(any())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return price("ETH", "1", "primary");
        });

        long start = System.nanoTime();
        assertThatThrownBy(() -> resolver.resolve(new TokenPriceRequest("ETH", "polygon"), Duration.ofMillis(200)))
                .isInstanceOfSatisfying(ResolutionTimeoutException.class,
                        e -> assertThat(e.getAttempted()).containsExactly("primary"));
        assertThat((System.nanoTime() - start) / 1_000_000).isLessThan(1_500);
        assertThat(cache.size()).isZero();
        verify(secondary, never()).fetch(any());
    }

    @Test
    @DisplayName("a fetch the executor refuses counts as that adapter failing and the chain moves on")
    void rejectedFetchFallsBack() {
        AtomicInteger submissions = new AtomicInteger();
        Executor refusesFirst = task -> {
            if (submissions.getAndIncrement() == 0) {
                throw new RejectedExecutionException("pool full");
            }
            executor.execute(task);
        };
        TokenPriceResolver guarded = new TokenPriceResolver(List.of(primary, secondary), new SymbolRegistry(), cache,
                refusesFirst, Duration.ofSeconds(5), Duration.ofSeconds(30));
        when(secondary.fetch(any())).thenReturn(price("ETH", "3499", "secondary"));

        Resolved<TokenPrice> result = guarded.resolve(new TokenPriceRequest("ETH", "polygon"));

        assertThat(result.data().source()).isEqualTo("secondary");
        verify(primary, never()).fetch(any());
    }

    @Test
    @DisplayName("every fetch refused by the executor ends in ResolutionException naming each provider")
    void allFetchesRejected() {
        Executor full = task -> {
            throw new RejectedExecutionException("pool full");
        };
        TokenPriceResolver guarded = new TokenPriceResolver(List.of(primary, secondary), new SymbolRegistry(), cache,
                full, Duration.ofSeconds(5), Duration.ofSeconds(30));

        assertThatThrownBy(() -> guarded.resolve(new TokenPriceRequest("ETH", "polygon")))
                .isInstanceOfSatisfying(ResolutionException.class,
                        e -> assertThat(e.getAttempted()).containsExactly("primary", "secondary"));
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("empty chain is rejected at construction")
    void emptyChainRejected() {
        assertThatThrownBy(() -> new TokenPriceResolver(List.of(), new SymbolRegistry(), cache, executor,
                Duration.ofSeconds(1), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static TokenPrice price(String symbol, String usd, String source) {
        return TokenPrice.of(symbol, new BigDecimal(usd), 1_700_000_000_000L, source);
    }
}
