package com.sensorplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SyntheticResponse(
    @JsonProperty("data") List<Double> data,
    @JsonProperty("timestamps") List<Double> timestamps,
    @JsonProperty("type") String type,
    @JsonProperty("length") int length,
    @JsonProperty("seed") long seed
) {}
