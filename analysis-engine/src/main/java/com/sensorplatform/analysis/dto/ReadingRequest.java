package com.sensorplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One streamed reading. A missing {@code timestamp} means "now".
 */
public record ReadingRequest(
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("value") Double value,
    @JsonProperty("timestamp") Instant timestamp
) {}
