package com.sensorplatform.analysis.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorplatform.common.exception.SensorAnalysisException;
import com.sensorplatform.common.exception.SensorAnalysisException.ErrorKind;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 *
 * <p>{@code error_kind} is present only when the failure came out of the analysis
 * engine, so clients can branch on it instead of parsing {@code message}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("status")
    int status,

    @JsonProperty("error")
    String error,

    @JsonProperty("error_kind")
    ErrorKind errorKind,

    @JsonProperty("message")
    String message,

    @JsonProperty("path")
    String path,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(status.value(), error, null, message, path, Instant.now());
    }

    /** INVALID_INPUT answers 400 "Invalid Input", anything else 500 "Computation Failure". */
    public static ErrorResponse fromAnalysis(SensorAnalysisException ex, String path) {
        HttpStatus status = statusOf(ex.getKind());
        String error = ex.isInvalidInput() ? "Invalid Input" : "Computation Failure";
        return new ErrorResponse(status.value(), error, ex.getKind(), ex.getDetail(), path, Instant.now());
    }

    private static HttpStatus statusOf(ErrorKind kind) {
        return kind == ErrorKind.INVALID_INPUT ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
