package com.chainoracle.api.dto;

/**
 * Success envelope for every oracle endpoint: {success: true, data, message}.
 */
public record OracleResponse<T>(boolean success, T data, String message) {

    public static <T> OracleResponse<T> ok(T data, String message) {
        return new OracleResponse<>(true, data, message);
    }
}
