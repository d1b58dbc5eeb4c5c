package com.chainoracle.api.controller;

import com.chainoracle.aggregate.MultiNetworkGasService;
import com.chainoracle.api.dto.GetGasPriceRequest;
import com.chainoracle.api.dto.GetHistoricalPriceRequest;
import com.chainoracle.api.dto.GetTokenPriceRequest;
import com.chainoracle.api.dto.OracleResponse;
import com.chainoracle.api.dto.PublishEventRequest;
import com.chainoracle.domain.ContractEvent;
import com.chainoracle.domain.GasPrice;
import com.chainoracle.domain.HealthSnapshot;
import com.chainoracle.domain.HistoricalPrice;
import com.chainoracle.domain.Resolved;
import com.chainoracle.domain.TokenPrice;
import com.chainoracle.health.HealthReporter;
import com.chainoracle.publish.ContractEventPublisher;
import com.chainoracle.resolver.GasPriceResolver;
import com.chainoracle.resolver.HistoricalPriceRequest;
import com.chainoracle.resolver.HistoricalPriceResolver;
import com.chainoracle.resolver.TokenPriceRequest;
import com.chainoracle.resolver.TokenPriceResolver;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * POST /api/token-price, /api/gas-price, /api/historical-price, /api/multi-network-gas, /api/publish-to-contract;
 * GET /api/health. Delegates only; resolution blocks, so every call is moved off the event loop.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class OracleController {

    private final TokenPriceResolver tokenPriceResolver;
    private final GasPriceResolver gasPriceResolver;
    private final HistoricalPriceResolver historicalPriceResolver;
    private final MultiNetworkGasService multiNetworkGasService;
    private final ContractEventPublisher contractEventPublisher;
    private final HealthReporter healthReporter;

    @PostMapping("/token-price")
    public Mono<OracleResponse<Resolved<TokenPrice>>> tokenPrice(@RequestBody @Valid GetTokenPriceRequest request) {
        return offload(() -> {
            Resolved<TokenPrice> price = tokenPriceResolver.resolve(
                    new TokenPriceRequest(request.symbol(), request.network()));
            return OracleResponse.ok(price,
                    "Token price for " + request.symbol().strip().toUpperCase(Locale.ROOT) + " fetched successfully");
        });
    }

    @PostMapping("/gas-price")
    public Mono<OracleResponse<Resolved<GasPrice>>> gasPrice(@RequestBody(required = false) GetGasPriceRequest request) {
        String network = request == null ? null : request.network();
        return offload(() -> {
            Resolved<GasPrice> gas = gasPriceResolver.resolve(network);
            return OracleResponse.ok(gas, "Gas price for " + gas.data().network() + " fetched successfully");
        });
    }

    @PostMapping("/historical-price")
    public Mono<OracleResponse<Resolved<HistoricalPrice>>> historicalPrice(
            @RequestBody @Valid GetHistoricalPriceRequest request) {
        return offload(() -> {
            Resolved<HistoricalPrice> price = historicalPriceResolver.resolve(
                    new HistoricalPriceRequest(request.symbol(), request.date(), request.network()));
            return OracleResponse.ok(price, "Historical price for " + price.data().symbol() + " on "
                    + request.date().strip() + " fetched successfully");
        });
    }

    /** Networks whose chain failed are absent from data. */
    @PostMapping("/multi-network-gas")
    public Mono<OracleResponse<Map<String, Resolved<GasPrice>>>> multiNetworkGas() {
        return offload(() -> {
            Map<String, Resolved<GasPrice>> byNetwork = new LinkedHashMap<>();
            multiNetworkGasService.resolveAll().forEach((network, gas) -> byNetwork.put(network.id(), gas));
            return OracleResponse.ok(byNetwork, "Multi-network gas prices fetched successfully");
        });
    }

    @PostMapping("/publish-to-contract")
    public Mono<OracleResponse<ContractEvent>> publishToContract(@RequestBody @Valid PublishEventRequest request) {
        return offload(() -> {
            ContractEvent event = contractEventPublisher.publish(
                    request.eventName(), request.contractAddress(), request.data());
            return OracleResponse.ok(event, "Event " + event.eventName() + " published to contract "
                    + event.contractAddress() + " successfully (simulated)");
        });
    }

    @GetMapping("/health")
    public Mono<OracleResponse<HealthSnapshot>> health() {
        return offload(() -> OracleResponse.ok(healthReporter.snapshot(), "Health check completed"));
    }

    private static <T> Mono<T> offload(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
