package com.chainoracle.resolver;

/**
 * Raw live-price request. Network may be null (defaults to polygon).
 */
public record TokenPriceRequest(String symbol, String network) {
}
