package com.sensorplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ReadingAccepted(
    @JsonProperty("status") String status,
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static ReadingAccepted received(String sensorId, Instant timestamp) {
        return new ReadingAccepted("received", sensorId, timestamp);
    }
}
