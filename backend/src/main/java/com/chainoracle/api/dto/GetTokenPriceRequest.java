package com.chainoracle.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/token-price body. Missing network means polygon.
 */
public record GetTokenPriceRequest(
        @NotBlank(message = "VALIDATION_ERROR")
        String symbol,

        String network
) {
}
