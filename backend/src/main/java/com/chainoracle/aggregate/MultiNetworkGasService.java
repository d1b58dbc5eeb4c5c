package com.chainoracle.aggregate;

import com.chainoracle.domain.GasPrice;
import com.chainoracle.domain.Network;
import com.chainoracle.domain.Resolved;
import com.chainoracle.resolver.GasPriceResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Gas prices for every configured aggregate network at once. Networks whose chain failed are absent from the map.
 * Configured networks the gas resolver has no chain for are dropped at construction.
 */
@Slf4j
public class MultiNetworkGasService {

    private final GasPriceResolver gasPriceResolver;
    private final MultiTargetAggregator aggregator;
    private final List<Network> networks;

    public MultiNetworkGasService(GasPriceResolver gasPriceResolver, MultiTargetAggregator aggregator,
                                  List<Network> networks) {
        Set<Network> supported = gasPriceResolver.supportedNetworks();
        networks.stream()
                .filter(n -> !supported.contains(n))
                .forEach(n -> log.warn("Aggregate network {} has no gas chain; skipped", n.id()));
        this.gasPriceResolver = gasPriceResolver;
        this.aggregator = aggregator;
        this.networks = networks.stream().filter(supported::contains).toList();
    }

    public Map<Network, Resolved<GasPrice>> resolveAll() {
        return aggregator.resolveAll(networks, network -> gasPriceResolver.resolve(network.id()));
    }
}
