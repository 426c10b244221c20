package com.sensorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Output of the health scorer.
 *
 * @param score          bounded health score in [0, 100]
 * @param status         band derived from {@code score}
 * @param diagnosis      phrasing led by the most severe finding
 * @param flags          distinct rule codes, most severe first
 * @param recommendation maintenance action for the most severe finding
 */
public record HealthAssessment(
    @JsonProperty("score") double score,
    @JsonProperty("status") HealthStatus status,
    @JsonProperty("diagnosis") String diagnosis,
    @JsonProperty("flags") List<String> flags,
    @JsonProperty("recommendation") String recommendation
) {
    public HealthAssessment {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static HealthAssessment noData() {
        return new HealthAssessment(0.0, HealthStatus.NO_DATA,
            "Insufficient data for analysis", List.of(), "Ingest more data points");
    }
}
