package com.chainoracle.api.dto;

/**
 * POST /api/gas-price body. The body itself and the network are optional; default polygon.
 */
public record GetGasPriceRequest(String network) {
}
