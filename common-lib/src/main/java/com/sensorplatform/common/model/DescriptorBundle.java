package com.sensorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * All descriptors computed for one cleaned series.
 *
 * <p>JSON field names follow the snake_case metric names stored alongside each
 * analysis result. {@code trend} and {@code residuals} carry the global linear fit
 * for charting; {@code noise_std} is estimated separately and is not their spread.
 */
public record DescriptorBundle(
    @JsonProperty("bias") double bias,
    @JsonProperty("slope") double slope,
    @JsonProperty("noise_std") double noiseStd,
    @JsonProperty("snr_db") double snrDb,
    @JsonProperty("hysteresis") double hysteresis,
    @JsonProperty("hysteresis_x") List<Double> hysteresisX,
    @JsonProperty("hysteresis_y") List<Double> hysteresisY,
    @JsonProperty("hurst") double hurst,
    @JsonProperty("hurst_r2") double hurstR2,
    @JsonProperty("dfa_scales") List<Double> dfaScales,
    @JsonProperty("dfa_fluctuations") List<Double> dfaFluctuations,
    @JsonProperty("trend") List<Double> trend,
    @JsonProperty("residuals") List<Double> residuals
) {
    public DescriptorBundle {
        hysteresisX     = hysteresisX == null ? List.of() : List.copyOf(hysteresisX);
        hysteresisY     = hysteresisY == null ? List.of() : List.copyOf(hysteresisY);
        dfaScales       = dfaScales == null ? List.of() : List.copyOf(dfaScales);
        dfaFluctuations = dfaFluctuations == null ? List.of() : List.copyOf(dfaFluctuations);
        trend           = trend == null ? List.of() : List.copyOf(trend);
        residuals       = residuals == null ? List.of() : List.copyOf(residuals);

        if (hysteresisX.size() != hysteresisY.size()) {
            throw new IllegalArgumentException("hysteresis_x and hysteresis_y differ in length: "
                + hysteresisX.size() + " vs " + hysteresisY.size());
        }
        if (dfaScales.size() != dfaFluctuations.size()) {
            throw new IllegalArgumentException("dfa_scales and dfa_fluctuations differ in length: "
                + dfaScales.size() + " vs " + dfaFluctuations.size());
        }
        if (hurst < 0.0 || hurst > 1.0) {
            throw new IllegalArgumentException("hurst outside [0,1]: " + hurst);
        }
        if (hurstR2 < 0.0 || hurstR2 > 1.0) {
            throw new IllegalArgumentException("hurst_r2 outside [0,1]: " + hurstR2);
        }
    }

    /** Bundle reported when the series is too short to analyse. */
    public static DescriptorBundle empty() {
        return new DescriptorBundle(0.0, 0.0, 0.0, 0.0, 0.0,
            List.of(), List.of(), 0.5, 0.0, List.of(), List.of(), List.of(), List.of());
    }
}
