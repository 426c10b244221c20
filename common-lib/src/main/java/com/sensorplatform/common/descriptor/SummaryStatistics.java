package com.sensorplatform.common.descriptor;

import com.sensorplatform.common.model.CleanSeries;
import com.sensorplatform.common.model.SeriesStatistics;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descriptive statistics for a cleaned series. Percentiles use linear
 * interpolation between closest ranks.
 */
public final class SummaryStatistics {

    static final int[] PERCENTILE_RANKS = {25, 50, 75, 90, 95, 99};

    private SummaryStatistics() {}

    /**
     * @return statistics; all zero (and no percentiles) for an empty series
     */
    public static SeriesStatistics compute(CleanSeries series) {
        if (series.isEmpty()) {
            return new SeriesStatistics(0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, Map.of());
        }
        double[] sorted = series.toArray();
        Arrays.sort(sorted);

        double std = series.std();
        Map<Integer, Double> percentiles = new LinkedHashMap<>();
        for (int p : PERCENTILE_RANKS) {
            percentiles.put(p, percentile(sorted, p));
        }
        return new SeriesStatistics(
            series.size(),
            series.mean(),
            std,
            std * std,
            sorted[0],
            sorted[sorted.length - 1],
            percentile(sorted, 50),
            sorted[sorted.length - 1] - sorted[0],
            percentiles);
    }

    /**
     * @param sorted ascending values, non-empty
     * @param rank   percentile in [0, 100]
     */
    static double percentile(double[] sorted, double rank) {
        double position = rank / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) return sorted[lower];
        double weight = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
    }
}
