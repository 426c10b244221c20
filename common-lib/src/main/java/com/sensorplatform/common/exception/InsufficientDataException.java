package com.sensorplatform.common.exception;

/**
 * Raised by the preprocessor when fewer valid readings remain than the analysis
 * needs. Recovered by {@code SensorHealthAnalyzer}, which answers with a
 * "No Data" assessment instead of propagating the failure.
 */
public class InsufficientDataException extends RuntimeException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Insufficient data: " + available + " valid readings, " + required + " required");
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
