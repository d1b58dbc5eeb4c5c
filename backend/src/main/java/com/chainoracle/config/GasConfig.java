package com.chainoracle.config;

import com.chainoracle.aggregate.MultiNetworkGasService;
import com.chainoracle.aggregate.MultiTargetAggregator;
import com.chainoracle.cache.TtlCache;
import com.chainoracle.domain.GasPrice;
import com.chainoracle.domain.Network;
import com.chainoracle.resolver.GasPriceResolver;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.gas.EthGasStationGasAdapter;
import com.chainoracle.source.gas.EtherscanGasAdapter;
import com.chainoracle.source.gas.JsonRpcGasAdapter;
import com.chainoracle.source.gas.OwlracleGasAdapter;
import com.chainoracle.source.rpc.EvmRpcClient;
import com.chainoracle.source.rpc.RpcEndpointRotator;
import com.chainoracle.source.rpc.WebClientEvmRpcClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Gas chains per network.
 * Polygon: Owlracle, JSON-RPC. Ethereum: EthGasStation, Etherscan, JSON-RPC.
 * The RPC tier is added only for networks with configured endpoints.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GasProperties.class)
public class GasConfig {

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(GasProperties gasProperties) {
        int rps = Math.max(1, gasProperties.getRpcRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, gasProperties.getRpcLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    public GasPriceResolver gasPriceResolver(GasProperties gas, OracleProperties oracle, EvmRpcClient evmRpcClient,
                                             @Qualifier("evmRpcRateLimiter") RateLimiter evmRpcRateLimiter,
                                             TtlCache ttlCache, WebClient.Builder webClientBuilder,
                                             ObjectMapper objectMapper, Clock clock,
                                             @Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor fetchExecutor) {
        Duration upstreamTimeout = Duration.ofMillis(oracle.getResolution().getUpstreamTimeoutMs());
        Map<Network, List<SourceAdapter<Network, GasPrice>>> chains = new EnumMap<>(Network.class);

        List<SourceAdapter<Network, GasPrice>> polygon = new ArrayList<>();
        polygon.add(new OwlracleGasAdapter(Network.POLYGON, gas.getOwlracleBaseUrl(), gas.getOwlracleApiKey(),
                webClientBuilder, objectMapper, upstreamTimeout, clock));
        chains.put(Network.POLYGON, polygon);

        List<SourceAdapter<Network, GasPrice>> ethereum = new ArrayList<>();
        ethereum.add(new EthGasStationGasAdapter(gas.getEthGasStationUrl(), webClientBuilder, objectMapper,
                upstreamTimeout, clock));
        ethereum.add(new EtherscanGasAdapter(gas.getEtherscanBaseUrl(), gas.getEtherscanApiKey(), webClientBuilder,
                objectMapper, upstreamTimeout, clock));
        chains.put(Network.ETHEREUM, ethereum);

        chains.forEach((network, chain) -> {
            List<String> urls = gas.getRpcUrls().get(network.id());
            if (urls == null || urls.isEmpty()) {
                log.warn("No RPC endpoints configured for {}; gas chain has no RPC tier", network.id());
                return;
            }
            chain.add(new JsonRpcGasAdapter(network, new RpcEndpointRotator(urls), evmRpcClient, evmRpcRateLimiter,
                    objectMapper, upstreamTimeout, clock));
        });

        return new GasPriceResolver(chains, ttlCache, fetchExecutor,
                Duration.ofMillis(oracle.getResolution().getDefaultTimeoutMs()),
                Duration.ofSeconds(gas.getTtlSeconds()));
    }

    @Bean
    public MultiTargetAggregator multiTargetAggregator(@Qualifier(AsyncConfig.FANOUT_EXECUTOR) Executor fanoutExecutor) {
        return new MultiTargetAggregator(fanoutExecutor);
    }

    @Bean
    public MultiNetworkGasService multiNetworkGasService(GasPriceResolver gasPriceResolver,
                                                         MultiTargetAggregator multiTargetAggregator,
                                                         GasProperties gasProperties) {
        return new MultiNetworkGasService(gasPriceResolver, multiTargetAggregator,
                List.copyOf(gasProperties.getAggregateNetworks()));
    }
}
