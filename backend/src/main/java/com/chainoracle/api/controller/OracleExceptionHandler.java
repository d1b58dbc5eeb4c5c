package com.chainoracle.api.controller;

import com.chainoracle.api.dto.ErrorBody;
import com.chainoracle.common.RequestValidationException;
import com.chainoracle.resolver.ResolutionException;
import com.chainoracle.resolver.ResolutionTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps failures to ErrorBody (error, message, timestamp): validation 400, resolution 502, timeout 504.
 */
@Slf4j
@RestControllerAdvice
public class OracleExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleBinding(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse(RequestValidationException.VALIDATION_ERROR);
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    /** Unreadable or missing body. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest()
                .body(ErrorBody.of(RequestValidationException.VALIDATION_ERROR, "Malformed request body"));
    }

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<ErrorBody> handleValidation(RequestValidationException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(ResolutionTimeoutException.class)
    public ResponseEntity<ErrorBody> handleTimeout(ResolutionTimeoutException ex) {
        log.warn("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ErrorBody.of("RESOLUTION_TIMEOUT", ex.getMessage()));
    }

    @ExceptionHandler(ResolutionException.class)
    public ResponseEntity<ErrorBody> handleResolution(ResolutionException ex) {
        log.warn("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of("RESOLUTION_FAILED", ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case RequestValidationException.INVALID_ADDRESS -> "Invalid contract address format";
            case RequestValidationException.INVALID_DATE -> "date is required (YYYY-MM-DD)";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
