package com.sensorplatform.analysis.exception;

import com.sensorplatform.common.exception.SensorAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Maps engine and request failures onto HTTP responses.
 *
 * <p>{@link SensorAnalysisException} is switched on its kind: INVALID_INPUT is the
 * caller's fault (400), COMPUTATION_FAILURE is ours (500).
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SensorAnalysisException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAnalysisException(
            SensorAnalysisException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        ErrorResponse response = ErrorResponse.fromAnalysis(ex, path);
        if (ex.isInvalidInput()) {
            log.warn("Invalid analysis input for {}: {}", path, ex.getDetail());
        } else {
            log.error("Analysis failed for {}: {}", path, ex.getDetail(), ex);
        }
        return Mono.just(ResponseEntity.status(response.status()).body(response));
    }

    /**
     * Unknown signal types and similar argument errors.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgument(
            IllegalArgumentException ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.warn("Invalid argument for {}: {}", path, ex.getMessage());

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Bad Request",
                ex.getMessage(),
                path
        );
        return Mono.just(ResponseEntity.badRequest().body(response));
    }

    /**
     * Malformed JSON, wrong field types, unreadable bodies.
     */
    @ExceptionHandler({DecodingException.class, ServerWebInputException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleDecodingException(
            Exception ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();
        String message = "Invalid request body";

        Throwable cause = ex.getCause();
        if (cause != null && cause.getMessage() != null) {
            message = cause.getMessage();
        }

        log.warn("Request decoding failed for {}: {}", path, message);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                message,
                path
        );
        return Mono.just(ResponseEntity.badRequest().body(response));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(
            Exception ex, ServerWebExchange exchange) {

        String path = exchange.getRequest().getPath().value();

        log.error("Unexpected error for {}: {}", path, ex.getMessage(), ex);

        ErrorResponse response = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                path
        );
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response));
    }
}
