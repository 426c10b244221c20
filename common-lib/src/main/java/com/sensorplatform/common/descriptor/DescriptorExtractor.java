package com.sensorplatform.common.descriptor;

import com.sensorplatform.common.model.CleanSeries;
import com.sensorplatform.common.model.DescriptorBundle;

/**
 * Runs every descriptor calculator over one cleaned series and assembles the
 * bundle. The calculators are independent; none consumes another's output.
 */
public final class DescriptorExtractor {

    private DescriptorExtractor() {}

    /**
     * @param series        cleaned readings, already checked against the analysis minimum
     * @param biasReference level the bias is measured from
     */
    public static DescriptorBundle extract(CleanSeries series, double biasReference) {
        double bias = BiasCalculator.compute(series, biasReference);
        double slope = SlopeCalculator.compute(series);
        NoiseCalculator.NoiseResult noise = NoiseCalculator.compute(series);
        HysteresisCalculator.HysteresisResult hysteresis = HysteresisCalculator.compute(series);
        DfaCalculator.DfaResult dfa = DfaCalculator.compute(series);
        TrendCalculator.TrendResult trend = TrendCalculator.compute(series);

        return new DescriptorBundle(
            bias,
            slope,
            noise.noiseStd(),
            noise.snrDb(),
            hysteresis.ratio(),
            hysteresis.x(),
            hysteresis.y(),
            dfa.hurst(),
            dfa.rSquared(),
            dfa.scales(),
            dfa.fluctuations(),
            trend.trend(),
            trend.residuals());
    }
}
