package com.sensorplatform.common.descriptor;

import com.sensorplatform.common.model.CleanSeries;

/**
 * Drift rate: OLS regression coefficient of value against sample index, in
 * units per sample.
 */
public final class SlopeCalculator {

    private SlopeCalculator() {}

    /**
     * @return slope; exactly 0 for a flat series or one with fewer than 2 readings
     */
    public static double compute(CleanSeries series) {
        if (series.size() < 2 || series.isFlat()) return 0.0;
        return LinearFit.ofIndex(series.toArray()).slope();
    }
}
