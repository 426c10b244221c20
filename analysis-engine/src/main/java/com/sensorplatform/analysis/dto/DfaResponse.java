package com.sensorplatform.analysis.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorplatform.common.descriptor.DfaCalculator;

import java.util.List;

public record DfaResponse(
    @JsonProperty("hurst") double hurst,
    @JsonProperty("hurst_r2") double hurstR2,
    @JsonProperty("dfa_scales") List<Double> scales,
    @JsonProperty("dfa_fluctuations") List<Double> fluctuations
) {
    public static DfaResponse from(DfaCalculator.DfaResult result) {
        return new DfaResponse(result.hurst(), result.rSquared(), result.scales(), result.fluctuations());
    }
}
