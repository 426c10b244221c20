package com.sensorplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorplatform.common.exception.SensorAnalysisException;

/**
 * Terminal result of one dispatched analysis task. A task never errors out; it
 * completes with either a report or a failure description.
 *
 * @param sensorId  sensor the task ran for
 * @param success   whether a report was produced
 * @param report    the report; {@code null} on failure
 * @param errorKind failure category; {@code null} on success
 * @param error     failure message without the kind prefix; {@code null} on success
 * @param attempts  number of attempts made, including the first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisOutcome(
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("success") boolean success,
    @JsonProperty("report") AnalysisReport report,
    @JsonProperty("error_kind") SensorAnalysisException.ErrorKind errorKind,
    @JsonProperty("error") String error,
    @JsonProperty("attempts") int attempts
) {
    public static AnalysisOutcome success(AnalysisReport report, int attempts) {
        return new AnalysisOutcome(report.sensorId(), true, report, null, null, attempts);
    }

    public static AnalysisOutcome failure(String sensorId, SensorAnalysisException.ErrorKind kind,
                                          String error, int attempts) {
        return new AnalysisOutcome(sensorId, false, null, kind, error, attempts);
    }

    /** Rebuilds the failure as the exception the HTTP layer maps to a status code. */
    @JsonIgnore
    public SensorAnalysisException toException() {
        if (success) {
            throw new IllegalStateException("Outcome for sensor " + sensorId + " is not a failure");
        }
        return new SensorAnalysisException(errorKind, error);
    }
}
