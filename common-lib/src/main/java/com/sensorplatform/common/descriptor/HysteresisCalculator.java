package com.sensorplatform.common.descriptor;

import com.sensorplatform.common.model.CleanSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Path-dependence of the signal, measured on its lag-1 phase portrait.
 *
 * <p>The series is embedded as points {@code (v[t], v[t+1])}. Both coordinates are
 * rescaled by the series range {@code (max - min)} onto the unit square, and the
 * signed area of the closed polygon through those points is taken with the
 * shoelace formula. Counter-clockwise loops are positive. A signal that retraces
 * the same path on its rising and falling excursions encloses no area.
 *
 * <p>The returned polyline is in the original units, for plotting.
 */
public final class HysteresisCalculator {

    private HysteresisCalculator() {}

    /**
     * @param ratio signed loop area on the unit-square portrait
     * @param x     {@code v[0..n-2]}
     * @param y     {@code v[1..n-1]}
     */
    public record HysteresisResult(double ratio, List<Double> x, List<Double> y) {
        public HysteresisResult {
            x = List.copyOf(x);
            y = List.copyOf(y);
        }
    }

    public static HysteresisResult compute(CleanSeries series) {
        int n = series.size();
        if (n < 2) return new HysteresisResult(0.0, List.of(), List.of());

        List<Double> xs = new ArrayList<>(n - 1);
        List<Double> ys = new ArrayList<>(n - 1);
        for (int t = 0; t < n - 1; t++) {
            xs.add(series.get(t));
            ys.add(series.get(t + 1));
        }

        double range = series.range();
        if (n < 3 || series.isFlat() || range == 0.0) {
            return new HysteresisResult(0.0, xs, ys);
        }
        return new HysteresisResult(loopArea(series, series.min(), range), xs, ys);
    }

    /** Shoelace area over the normalized portrait, polygon closed back to its first vertex. */
    private static double loopArea(CleanSeries series, double min, double range) {
        int points = series.size() - 1;
        double twiceArea = 0;
        for (int k = 0; k < points; k++) {
            int next = (k + 1) % points;
            double xk = (series.get(k) - min) / range;
            double yk = (series.get(k + 1) - min) / range;
            double xn = (series.get(next) - min) / range;
            double yn = (series.get(next + 1) - min) / range;
            twiceArea += xk * yn - xn * yk;
        }
        return twiceArea / 2.0;
    }
}
