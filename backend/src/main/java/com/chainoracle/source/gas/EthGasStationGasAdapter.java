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
 * Ethereum gas tiers from the ETH Gas Station JSON feed, which reports in tenths of a gwei
 * (average, fast, fastest).
 */
public class EthGasStationGasAdapter extends HttpSourceSupport implements SourceAdapter<Network, GasPrice> {

    public static final String PROVIDER = "ethgasstation";

    private final String url;
    private final Clock clock;

    public EthGasStationGasAdapter(String url, WebClient.Builder webClientBuilder, ObjectMapper objectMapper,
                                   Duration requestTimeout, Clock clock) {
        super(webClientBuilder, objectMapper, requestTimeout);
        this.url = url;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return PROVIDER;
    }

    @Override
    public GasPrice fetch(Network query) {
        return parse(readTree(getBody(url, Map.of())), clock.millis());
    }

    @Override
    public boolean isHealthy() {
        return probe(url);
    }

    static GasPrice parse(JsonNode root, long timestamp) {
        BigDecimal average = tenthsToGwei(root.path("average"));
        BigDecimal fast = tenthsToGwei(root.path("fast"));
        BigDecimal fastest = tenthsToGwei(root.path("fastest"));
        if (average == null || fast == null || fastest == null) {
            throw new UpstreamException(PROVIDER, "unexpected payload: average/fast/fastest missing");
        }
        return GasPrice.gwei(Network.ETHEREUM, average, fast, fastest, timestamp);
    }

    private static BigDecimal tenthsToGwei(JsonNode node) {
        BigDecimal tenths = decimalOrNull(node);
        if (tenths == null || tenths.signum() <= 0) {
            return null;
        }
        return tenths.movePointLeft(1);
    }
}
