package com.sensorplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record BatchRequest(
    @JsonProperty("sensor_ids") List<String> sensorIds,
    @JsonProperty("config") Map<String, Object> config,
    @JsonProperty("window_size") Integer windowSize
) {}
