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
import java.util.EnumMap;
import java.util.Map;

/**
 * Gas tiers from Owlracle /{chain}/gas. Standard is the first speed with at least 90% acceptance, fast the first
 * with at least 95%, instant the last speed. Acceptance may arrive as a fraction (0.9) or a percentage (90).
 */
public class OwlracleGasAdapter extends HttpSourceSupport implements SourceAdapter<Network, GasPrice> {

    private static final Map<Network, String> CHAIN_SLUGS = new EnumMap<>(Network.class);

    static {
        CHAIN_SLUGS.put(Network.ETHEREUM, "eth");
        CHAIN_SLUGS.put(Network.POLYGON, "poly");
        CHAIN_SLUGS.put(Network.BSC, "bsc");
        CHAIN_SLUGS.put(Network.ARBITRUM, "arb");
        CHAIN_SLUGS.put(Network.OPTIMISM, "opt");
    }

    private static final BigDecimal STANDARD_ACCEPTANCE = BigDecimal.valueOf(90);
    private static final BigDecimal FAST_ACCEPTANCE = BigDecimal.valueOf(95);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Network network;
    private final String baseUrl;
    private final String apiKey;
    private final Clock clock;

    public OwlracleGasAdapter(Network network, String baseUrl, String apiKey, WebClient.Builder webClientBuilder,
                              ObjectMapper objectMapper, Duration requestTimeout, Clock clock) {
        super(webClientBuilder, objectMapper, requestTimeout);
        if (!CHAIN_SLUGS.containsKey(network)) {
            throw new IllegalArgumentException("Owlracle does not cover " + network);
        }
        this.network = network;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return "owlracle-" + network.id();
    }

    @Override
    public GasPrice fetch(Network query) {
        String body = getBody(gasUrl(), Map.of());
        return parse(readTree(body), network, providerId(), clock.millis());
    }

    @Override
    public boolean isHealthy() {
        return probe(gasUrl());
    }

    private String gasUrl() {
        String url = baseUrl + "/" + CHAIN_SLUGS.get(network) + "/gas";
        return apiKey == null || apiKey.isBlank() ? url : url + "?apikey=" + apiKey;
    }

    static GasPrice parse(JsonNode root, Network network, String providerId, long timestamp) {
        JsonNode speeds = root.path("speeds");
        if (!speeds.isArray() || speeds.isEmpty()) {
            throw new UpstreamException(providerId, "invalid gas data: no speeds");
        }
        BigDecimal standard = firstWithAcceptance(speeds, STANDARD_ACCEPTANCE);
        if (standard == null) {
            standard = gasPriceAt(speeds, 0);
        }
        BigDecimal fast = firstWithAcceptance(speeds, FAST_ACCEPTANCE);
        if (fast == null) {
            fast = speeds.size() > 1 ? gasPriceAt(speeds, 1) : standard;
        }
        BigDecimal instant = gasPriceAt(speeds, speeds.size() - 1);
        if (instant == null) {
            instant = fast;
        }
        if (standard == null || fast == null || instant == null) {
            throw new UpstreamException(providerId, "invalid gas data: missing gas price");
        }
        return GasPrice.gwei(network, standard, fast, instant, timestamp);
    }

    private static BigDecimal firstWithAcceptance(JsonNode speeds, BigDecimal minPercent) {
        for (JsonNode speed : speeds) {
            BigDecimal acceptance = decimalOrNull(speed.path("acceptance"));
            if (acceptance == null) {
                continue;
            }
            if (acceptance.compareTo(BigDecimal.ONE) <= 0) {
                acceptance = acceptance.multiply(HUNDRED);
            }
            if (acceptance.compareTo(minPercent) >= 0) {
                BigDecimal price = gasPrice(speed);
                if (price != null) {
                    return price;
                }
            }
        }
        return null;
    }

    private static BigDecimal gasPriceAt(JsonNode speeds, int index) {
        return gasPrice(speeds.path(index));
    }

    private static BigDecimal gasPrice(JsonNode speed) {
        BigDecimal price = decimalOrNull(speed.path("gasPrice"));
        if (price == null) {
            price = decimalOrNull(speed.path("maxFeePerGas"));
        }
        return price != null && price.signum() > 0 ? price : null;
    }
}
