package com.chainoracle.config;

import com.chainoracle.domain.Network;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Gas providers and RPC endpoints. Documented in application.yml under chainoracle.gas.
 */
@ConfigurationProperties(prefix = "chainoracle.gas")
@Getter
@Setter
public class GasProperties {

    private String owlracleBaseUrl = "https://api.owlracle.info/v4";

    private String owlracleApiKey;

    private String ethGasStationUrl = "https://ethgasstation.info/api/ethgasAPI.json";

    private String etherscanBaseUrl = "https://api.etherscan.io";

    private String etherscanApiKey;

    /**
     * JSON-RPC endpoints per network id (e.g. polygon, ethereum); used round-robin for eth_gasPrice.
     */
    private Map<String, List<String>> rpcUrls = new HashMap<>(Map.of(
            "polygon", List.of("https://polygon-rpc.com"),
            "ethereum", List.of("https://eth.llamarpc.com")));

    /**
     * Local limiter across all RPC endpoints.
     */
    private int rpcRequestsPerSecond = 10;

    /**
     * Max wait for a local RPC permit before the call fails over.
     */
    private long rpcLimiterTimeoutMs = 500;

    private int ttlSeconds = 30;

    /**
     * Targets of the multi-network gas request.
     */
    private List<Network> aggregateNetworks = new ArrayList<>(List.of(Network.POLYGON, Network.ETHEREUM));
}
