package com.chainoracle.common;

/**
 * Malformed or unsupported input, detected before any upstream call. {@code code} is the API error code.
 */
public class RequestValidationException extends RuntimeException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_NETWORK = "INVALID_NETWORK";
    public static final String INVALID_DATE = "INVALID_DATE";
    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";

    private final String code;

    public RequestValidationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public RequestValidationException(String message) {
        this(VALIDATION_ERROR, message);
    }

    public String getCode() {
        return code;
    }
}
