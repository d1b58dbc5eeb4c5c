package com.chainoracle.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/historical-price body. date is YYYY-MM-DD; missing network means polygon.
 */
public record GetHistoricalPriceRequest(
        @NotBlank(message = "VALIDATION_ERROR")
        String symbol,

        @NotBlank(message = "INVALID_DATE")
        String date,

        String network
) {
}
