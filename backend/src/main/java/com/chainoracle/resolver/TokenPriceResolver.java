package com.chainoracle.resolver;

import com.chainoracle.cache.CacheKeys;
import com.chainoracle.cache.TtlCache;
import com.chainoracle.common.SymbolRegistry;
import com.chainoracle.domain.Category;
import com.chainoracle.domain.Network;
import com.chainoracle.domain.TokenPrice;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.TokenQuery;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Live token price. Chain: keyed CoinGecko (when configured) → public CoinGecko → Coinbase.
 * Key: token_price:{SYMBOL}:{network}.
 */
public class TokenPriceResolver extends CategoryResolver<TokenPriceRequest, TokenQuery, TokenPrice> {

    private final List<SourceAdapter<TokenQuery, TokenPrice>> chain;
    private final SymbolRegistry symbolRegistry;
    private final Duration ttl;

    public TokenPriceResolver(List<SourceAdapter<TokenQuery, TokenPrice>> chain, SymbolRegistry symbolRegistry,
                              TtlCache cache, Executor executor, Duration defaultTimeout, Duration ttl) {
        super(Category.TOKEN_PRICE, TokenPrice.class, cache, executor, defaultTimeout);
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("token price chain must not be empty");
        }
        this.chain = List.copyOf(chain);
        this.symbolRegistry = symbolRegistry;
        this.ttl = ttl;
    }

    @Override
    protected TokenQuery normalize(TokenPriceRequest request) {
        String symbol = RequestNormalizer.symbol(request.symbol());
        Network network = RequestNormalizer.network(request.network());
        return new TokenQuery(symbol, symbolRegistry.coinGeckoId(symbol), network);
    }

    @Override
    public String cacheKey(TokenQuery query) {
        return CacheKeys.build(Category.TOKEN_PRICE.keyPrefix(), query.symbol(), query.network().id());
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    protected List<SourceAdapter<TokenQuery, TokenPrice>> chainFor(TokenQuery query) {
        return chain;
    }

    @Override
    public List<SourceAdapter<TokenQuery, TokenPrice>> adapters() {
        return chain;
    }
}
