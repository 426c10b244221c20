package com.sensorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Plain descriptive statistics of a cleaned series. Percentile keys are the
 * requested percentile ranks (25, 50, 75, 90, 95, 99).
 */
public record SeriesStatistics(
    @JsonProperty("count") int count,
    @JsonProperty("mean") double mean,
    @JsonProperty("std") double std,
    @JsonProperty("variance") double variance,
    @JsonProperty("min") double min,
    @JsonProperty("max") double max,
    @JsonProperty("median") double median,
    @JsonProperty("range") double range,
    @JsonProperty("percentiles") Map<Integer, Double> percentiles
) {
    public SeriesStatistics {
        percentiles = percentiles == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(percentiles));
    }
}
