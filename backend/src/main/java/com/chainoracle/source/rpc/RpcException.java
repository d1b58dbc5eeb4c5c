package com.chainoracle.source.rpc;

/**
 * Thrown when an RPC call fails (HTTP or JSON-RPC error object).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
