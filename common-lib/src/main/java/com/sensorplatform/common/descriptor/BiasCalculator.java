package com.sensorplatform.common.descriptor;

import com.sensorplatform.common.model.CleanSeries;

/**
 * Steady-state offset: mean deviation of the readings from a reference level.
 */
public final class BiasCalculator {

    private BiasCalculator() {}

    /** Offset from zero. */
    public static double compute(CleanSeries series) {
        return compute(series, 0.0);
    }

    /**
     * @param reference expected level (set point) of the sensor
     * @return {@code mean(values) - reference}; 0 for an empty series
     */
    public static double compute(CleanSeries series, double reference) {
        if (series.isEmpty()) return 0.0;
        return series.mean() - reference;
    }
}
