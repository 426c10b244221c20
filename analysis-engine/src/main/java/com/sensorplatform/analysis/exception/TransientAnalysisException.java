package com.sensorplatform.analysis.exception;

/**
 * A failure worth retrying: the reading store was unreachable or timed out.
 * Anything else (bad input, a numeric fault) fails the task on the first attempt.
 */
public class TransientAnalysisException extends RuntimeException {

    public TransientAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
