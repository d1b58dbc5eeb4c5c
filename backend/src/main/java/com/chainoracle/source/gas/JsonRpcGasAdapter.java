package com.chainoracle.source.gas;

import com.chainoracle.domain.GasPrice;
import com.chainoracle.domain.Network;
import com.chainoracle.source.SourceAdapter;
import com.chainoracle.source.UpstreamException;
import com.chainoracle.source.rpc.EvmRpcClient;
import com.chainoracle.source.rpc.RpcEndpointRotator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;

/**
 * Gas tiers derived from a node's eth_gasPrice: standard is the node's price, fast is 1.2x, instant is 1.5x.
 */
@Slf4j
public class JsonRpcGasAdapter implements SourceAdapter<Network, GasPrice> {

    private static final int GWEI_SCALE = 9;
    private static final BigDecimal FAST_MULTIPLIER = new BigDecimal("1.2");
    private static final BigDecimal INSTANT_MULTIPLIER = new BigDecimal("1.5");

    private final Network network;
    private final RpcEndpointRotator rotator;
    private final EvmRpcClient rpcClient;
    private final RateLimiter rpcRateLimiter;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Clock clock;

    public JsonRpcGasAdapter(Network network, RpcEndpointRotator rotator, EvmRpcClient rpcClient,
                             RateLimiter rpcRateLimiter, ObjectMapper objectMapper, Duration requestTimeout,
                             Clock clock) {
        this.network = network;
        this.rotator = rotator;
        this.rpcClient = rpcClient;
        this.rpcRateLimiter = rpcRateLimiter;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return network.id() + "-rpc";
    }

    @Override
    public GasPrice fetch(Network query) {
        JsonNode result = call("eth_gasPrice");
        BigDecimal gwei = weiToGwei(parseQuantity(result));
        if (gwei.signum() <= 0) {
            throw new UpstreamException(providerId(), "node reported zero gas price");
        }
        return GasPrice.gwei(network,
                gwei,
                plain(gwei.multiply(FAST_MULTIPLIER).setScale(GWEI_SCALE, RoundingMode.HALF_UP)),
                plain(gwei.multiply(INSTANT_MULTIPLIER).setScale(GWEI_SCALE, RoundingMode.HALF_UP)),
                clock.millis());
    }

    /**
     * eth_blockNumber against the next endpoint.
     */
    @Override
    public boolean isHealthy() {
        try {
            parseQuantity(call("eth_blockNumber"));
            return true;
        } catch (Exception e) {
            log.debug("RPC health probe for {} failed: {}", network.id(), e.getMessage());
            return false;
        }
    }

    private JsonNode call(String method) {
        if (!rpcRateLimiter.acquirePermission()) {
            throw new UpstreamException(providerId(), "RPC rate limit exhausted");
        }
        String endpoint = rotator.getNextEndpoint();
        String body;
        try {
            body = rpcClient.call(endpoint, method, null).block(requestTimeout);
        } catch (Exception e) {
            throw new UpstreamException(providerId(), method + " failed on " + endpoint + ": " + e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new UpstreamException(providerId(), method + " returned empty body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new UpstreamException(providerId(), "malformed JSON-RPC response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new UpstreamException(providerId(), "RPC error: " + error.path("message").asText(error.toString()));
        }
        JsonNode result = root.path("result");
        if (!result.isTextual()) {
            throw new UpstreamException(providerId(), method + " result missing");
        }
        return result;
    }

    private BigInteger parseQuantity(JsonNode result) {
        String hex = result.asText();
        if (!hex.startsWith("0x") || hex.length() < 3) {
            throw new UpstreamException(providerId(), "invalid hex quantity: " + hex);
        }
        try {
            return new BigInteger(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            throw new UpstreamException(providerId(), "invalid hex quantity: " + hex, e);
        }
    }

    static BigDecimal weiToGwei(BigInteger wei) {
        return plain(new BigDecimal(wei).movePointLeft(GWEI_SCALE));
    }

    private static BigDecimal plain(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
