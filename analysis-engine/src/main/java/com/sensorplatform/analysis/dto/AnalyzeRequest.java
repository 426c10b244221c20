package com.sensorplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/v1/analyze}.
 *
 * <p>With {@code values} present the readings are analysed as given, so an empty
 * array yields a "No Data" report. Without them the sensor's stored readings are used: the {@code from}/{@code to} range when
 * either is set, otherwise the newest {@code window_size} readings.
 *
 * <p>{@code config} is kept untyped so unknown threshold names can be rejected
 * with a clear message.
 */
public record AnalyzeRequest(
    @JsonProperty("sensor_id") String sensorId,
    @JsonProperty("values") List<Double> values,
    @JsonProperty("config") Map<String, Object> config,
    @JsonProperty("from") Instant from,
    @JsonProperty("to") Instant to,
    @JsonProperty("window_size") Integer windowSize
) {
    public boolean hasValues() {
        return values != null;
    }
}
