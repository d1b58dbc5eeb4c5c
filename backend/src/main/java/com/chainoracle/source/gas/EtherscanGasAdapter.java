package com.chainoracle.source.gas;

import com.chainoracle.domain.GasPrice;
import com.chainoracle.domain.Network;
import com.chainoracle.source.HttpSourceSupport;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.UpstreamException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.reactive.function.client.WebClient;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Ethereum gas tiers from the Etherscan gas oracle (Safe / Propose / Fast). A status other than "1" is a failure.
 */
public class EtherscanGasAdapter extends HttpSourceSupport implements SourceAdapter<Network, GasPrice> {

    public static final String PROVIDER = "etherscan";

    private final String baseUrl;
    private final String apiKey;
    private final Clock clock;

    public EtherscanGasAdapter(String baseUrl, String apiKey, WebClient.Builder webClientBuilder,
                               ObjectMapper objectMapper, Duration requestTimeout, Clock clock) {
        super(webClientBuilder, objectMapper, requestTimeout);
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return PROVIDER;
    }

    @Override
    public GasPrice fetch(Network query) {
        return parse(readTree(getBody(oracleUrl(), Map.of())), clock.millis());
    }

    @Override
    public boolean isHealthy() {
        return probe(oracleUrl());
    }

    private String oracleUrl() {
        String url = baseUrl + "/api?module=gastracker&action=gasoracle";
        return apiKey == null || apiKey.isBlank() ? url : url + "&apikey=" + apiKey;
    }

    static GasPrice parse(JsonNode root, long timestamp) {
        if (!"1".equals(root.path("status").asText())) {
            throw new UpstreamException(PROVIDER, "API error: " + root.path("message").asText("unknown")
                    + " " + root.path("result").asText(""));
        }
        JsonNode result = root.path("result");
        BigDecimal safe = positive(result.path("SafeGasPrice"));
        BigDecimal propose = positive(result.path("ProposeGasPrice"));
        BigDecimal fast = positive(result.path("FastGasPrice"));
        if (safe == null || propose == null || fast == null) {
            throw new UpstreamException(PROVIDER, "unexpected payload: gas oracle tiers missing");
        }
        return GasPrice.gwei(Network.ETHEREUM, safe, propose, fast, timestamp);
    }

    private static BigDecimal positive(JsonNode node) {
        BigDecimal value = decimalOrNull(node);
        return value != null && value.signum() > 0 ? value : null;
    }
}
