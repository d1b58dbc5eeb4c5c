package com.chainoracle.api.dto;

import com.chainoracle.api.validation.ContractAddress;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * POST /api/publish-to-contract body. data is passed through untouched.
 */
public record PublishEventRequest(
        @NotBlank(message = "VALIDATION_ERROR")
        String eventName,

        @NotBlank(message = "INVALID_ADDRESS")
        @ContractAddress
        String contractAddress,

        @NotNull(message = "VALIDATION_ERROR")
        Map<String, Object> data
) {
}
