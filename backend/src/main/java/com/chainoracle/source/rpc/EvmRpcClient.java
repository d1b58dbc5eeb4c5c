package com.chainoracle.source.rpc;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Separated from the gas adapter so tests can stub responses.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_gasPrice"
     * @param params      method params; null sends an empty array
     * @return raw JSON response body; errors with {@link RpcException} on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
