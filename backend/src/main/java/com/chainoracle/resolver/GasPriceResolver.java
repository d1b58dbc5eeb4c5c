package com.chainoracle.resolver;

import com.chainoracle.cache.CacheKeys;
import com.chainoracle.cache.TtlCache;
import com.chainoracle.common.RequestValidationException;
import com.chainoracle.domain.Category;
import com.chainoracle.domain.GasPrice;
import com.chainoracle.domain.Network;
import com.chainoracle.source.SourceAdapter;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Gas tiers per network, one fallback chain per supported network. Networks without a chain are rejected before
 * any I/O. Tiers are returned as the provider reported them, even when out of order. Key: gas_price:{network}.
 */
public class GasPriceResolver extends CategoryResolver<String, Network, GasPrice> {

    private final Map<Network, List<SourceAdapter<Network, GasPrice>>> chains;
    private final Duration ttl;

    public GasPriceResolver(Map<Network, List<SourceAdapter<Network, GasPrice>>> chains, TtlCache cache,
                            Executor executor, Duration defaultTimeout, Duration ttl) {
        super(Category.GAS_PRICE, GasPrice.class, cache, executor, defaultTimeout);
        EnumMap<Network, List<SourceAdapter<Network, GasPrice>>> copy = new EnumMap<>(Network.class);
        chains.forEach((network, chain) -> {
            if (!chain.isEmpty()) {
                copy.put(network, List.copyOf(chain));
            }
        });
        this.chains = Collections.unmodifiableMap(copy);
        this.ttl = ttl;
    }

    /**
     * Networks with a non-empty chain.
     */
    public Set<Network> supportedNetworks() {
        return chains.keySet();
    }

    @Override
    protected Network normalize(String network) {
        Network parsed = RequestNormalizer.network(network);
        if (!chains.containsKey(parsed)) {
            throw new RequestValidationException(RequestValidationException.INVALID_NETWORK,
                    "Unsupported network for gas prices: " + parsed.id() + " (supported: "
                            + chains.keySet().stream().map(Network::id).collect(Collectors.joining(", ")) + ")");
        }
        return parsed;
    }

    @Override
    public String cacheKey(Network network) {
        return CacheKeys.build(Category.GAS_PRICE.keyPrefix(), network.id());
    }

    @Override
    public Duration ttl() {
        return ttl;
    }

    @Override
    protected List<SourceAdapter<Network, GasPrice>> chainFor(Network network) {
        return chains.get(network);
    }

    @Override
    public List<SourceAdapter<Network, GasPrice>> adapters() {
        return chains.values().stream().flatMap(List::stream).toList();
    }
}
