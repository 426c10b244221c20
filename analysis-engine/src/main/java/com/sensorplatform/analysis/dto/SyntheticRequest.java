package com.sensorplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param type   signal shape name, case-insensitive ({@code Normal}, {@code Drifting}, ...)
 * @param length number of samples; {@code null} for 100
 * @param seed   noise seed; {@code null} for a random one
 */
public record SyntheticRequest(
    @JsonProperty("type") String type,
    @JsonProperty("length") Integer length,
    @JsonProperty("seed") Long seed
) {}
