package com.sensorplatform.common.descriptor;

import com.sensorplatform.common.model.CleanSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Global linear trend of a series and the residual left after removing it.
 */
public final class TrendCalculator {

    private TrendCalculator() {}

    /**
     * @param fit       the regression line against sample index
     * @param trend     fitted value per sample
     * @param residuals {@code value - trend} per sample
     */
    public record TrendResult(LinearFit fit, List<Double> trend, List<Double> residuals) {
        public TrendResult {
            trend = List.copyOf(trend);
            residuals = List.copyOf(residuals);
        }
    }

    public static TrendResult compute(CleanSeries series) {
        double[] values = series.toArray();
        LinearFit fit = series.isFlat()
            ? new LinearFit(0.0, values.length == 0 ? 0.0 : values[0], 0.0)
            : LinearFit.ofIndex(values);

        List<Double> trend = new ArrayList<>(values.length);
        List<Double> residuals = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double fitted = fit.valueAt(i);
            trend.add(fitted);
            residuals.add(values[i] - fitted);
        }
        return new TrendResult(fit, trend, residuals);
    }
}
