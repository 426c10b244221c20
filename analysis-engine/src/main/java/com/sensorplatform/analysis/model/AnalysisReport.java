package com.sensorplatform.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorplatform.common.model.AnalysisOutput;
import com.sensorplatform.common.model.DescriptorBundle;
import com.sensorplatform.common.model.HealthStatus;

import java.time.Instant;
import java.util.List;

/**
 * One persisted analysis of one sensor: the health assessment, the RUL phrase and
 * the full descriptor bundle. This is the shape the result store keeps and the
 * history endpoint returns.
 */
public record AnalysisReport(
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("health_score") double healthScore,
    @JsonProperty("status") HealthStatus status,
    @JsonProperty("diagnosis") String diagnosis,
    @JsonProperty("flags") List<String> flags,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("prediction") String prediction,
    @JsonProperty("metrics") DescriptorBundle metrics
) {
    public AnalysisReport {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static AnalysisReport of(String sensorId, Instant timestamp, AnalysisOutput output) {
        return new AnalysisReport(
            sensorId,
            timestamp,
            output.health().score(),
            output.health().status(),
            output.health().diagnosis(),
            output.health().flags(),
            output.health().recommendation(),
            output.rul().description(),
            output.descriptors());
    }

    /** Whether the engine had enough readings to assess the sensor. */
    public boolean hasData() {
        return status != HealthStatus.NO_DATA;
    }
}
