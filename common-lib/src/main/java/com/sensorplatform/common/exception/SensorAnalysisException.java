package com.sensorplatform.common.exception;

/**
 * The single failure type that escapes the analysis engine.
 *
 * <p>{@link ErrorKind#INVALID_INPUT} marks a caller contract violation (null or
 * non-numeric series, mis-shaped payload, invalid configuration) and maps to a
 * client-facing error. {@link ErrorKind#COMPUTATION_FAILURE} marks an unexpected
 * fault inside the engine and maps to a server-facing error. Hosting layers
 * switch on {@link #getKind()}, never on the message text.
 */
public class SensorAnalysisException extends RuntimeException {

    public enum ErrorKind { INVALID_INPUT, COMPUTATION_FAILURE }

    private final ErrorKind kind;
    private final String detail;

    public SensorAnalysisException(ErrorKind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
        this.detail = message;
    }

    public SensorAnalysisException(ErrorKind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
        this.detail = message;
    }

    public static SensorAnalysisException invalidInput(String message) {
        return new SensorAnalysisException(ErrorKind.INVALID_INPUT, message);
    }

    public static SensorAnalysisException computationFailure(String message, Throwable cause) {
        return new SensorAnalysisException(ErrorKind.COMPUTATION_FAILURE, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /** The message as given, without the {@code [KIND]} prefix of {@link #getMessage()}. */
    public String getDetail() {
        return detail;
    }

    public boolean isInvalidInput() {
        return kind == ErrorKind.INVALID_INPUT;
    }
}
