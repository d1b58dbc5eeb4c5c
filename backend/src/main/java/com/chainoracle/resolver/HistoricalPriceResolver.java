package com.chainoracle.resolver;

import com.chainoracle.cache.CacheKeys;
import com.chainoracle.cache.TtlCache;
import com.chainoracle.common.SymbolRegistry;
import com.chainoracle.domain.Category;
import com.chainoracle.domain.HistoricalPrice;
import com.chainoracle.domain.Network;
import com.chainoracle.source.HistoricalQuery;
import com.chainoracle.source.SourceAdapter;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Price of a token on a past date. The date is validated before anything else; a past date's price does not change,
 * so entries live for a day. Key: historical_price:{SYMBOL}:{YYYY-MM-DD}:{network}.
 */
public class HistoricalPriceResolver extends CategoryResolver<HistoricalPriceRequest, HistoricalQuery, HistoricalPrice> {

    private final List<SourceAdapter<HistoricalQuery, HistoricalPrice>> chain;
    private final SymbolRegistry symbolRegistry;
    private final Duration ttl;

    public HistoricalPriceResolver(List<SourceAdapter<HistoricalQuery, HistoricalPrice>> chain,
                                   SymbolRegistry symbolRegistry, TtlCache cache, Executor executor,
                                   Duration defaultTimeout, Duration ttl) {
        super(Category.HISTORICAL_PRICE, HistoricalPrice.class, cache, executor, defaultTimeout);
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("historical price chain must not be empty");
        }
        this.chain = List.copyOf(chain);
        this.symbolRegistry = symbolRegistry;
        this.ttl = ttl;
    }

    @Override
    protected HistoricalQuery normalize(HistoricalPriceRequest request) {
        LocalDate date = RequestNormalizer.date(request.date());
        String symbol = RequestNormalizer.symbol(request.symbol());
        Network network = RequestNormalizer.network(request.network());
        return new HistoricalQuery(symbol, symbolRegistry.coinGeckoId(symbol), date, network);
    }

    @Override
    public String cacheKey(HistoricalQuery query) {
        return CacheKeys.build(Category.HISTORICAL_PRICE.keyPrefix(), query.symbol(), query.date(), query.network().id());
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    protected List<SourceAdapter<HistoricalQuery, HistoricalPrice>> chainFor(HistoricalQuery query) {
        return chain;
    }

    @Override
    public List<SourceAdapter<HistoricalQuery, HistoricalPrice>> adapters() {
        return chain;
    }
}
