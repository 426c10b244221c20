package com.sensorplatform.common.health;

import com.sensorplatform.common.descriptor.LinearFit;
import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.model.CleanSeries;
import com.sensorplatform.common.model.RulEstimate;

import java.util.Locale;

/**
 * Remaining-useful-life projection by linear extrapolation.
 *
 * <p>The failure boundary sits {@code rul_drift_limit} away from the trend
 * baseline (the intercept of the global linear fit), on the side the series is
 * drifting towards. The remaining number of readings is the distance from the
 * last observed value to that boundary divided by {@code |slope|}.
 *
 * <p>This is a coarse straight-line projection. It assumes the current drift rate
 * holds and ignores noise, acceleration and any stochastic failure behaviour;
 * treat it as an early-warning hint, not a survival model.
 */
public final class RulEstimator {

    /** Slopes below this (units per sample) count as no discernible trend. */
    public static final double FLAT_SLOPE_EPSILON = 1e-6;

    static final String BOUNDARY_EXCEEDED = "Failure boundary already exceeded";

    private RulEstimator() {}

    public static RulEstimate estimate(CleanSeries series, double slope, AnalysisConfig config) {
        if (series.isEmpty() || !Double.isFinite(slope) || Math.abs(slope) < FLAT_SLOPE_EPSILON) {
            return RulEstimate.notAvailable();
        }
        double baseline = LinearFit.ofIndex(series.toArray()).intercept();
        double boundary = baseline + Math.signum(slope) * config.rulDriftLimit();
        double remaining = (boundary - series.last()) / slope;

        if (!Double.isFinite(remaining)) return RulEstimate.notAvailable();
        if (remaining <= 0) return new RulEstimate(BOUNDARY_EXCEEDED, 0.0);

        long readings = (long) Math.ceil(remaining);
        double seconds = remaining * config.sampleIntervalSeconds();
        String description = String.format(Locale.ROOT,
            "Approximately %d readings (~%s) until failure boundary", readings, humanDuration(seconds));
        return new RulEstimate(description, remaining);
    }

    static String humanDuration(double seconds) {
        if (seconds < 120) return String.format(Locale.ROOT, "%.0f seconds", seconds);
        double minutes = seconds / 60.0;
        if (minutes < 120) return String.format(Locale.ROOT, "%.1f minutes", minutes);
        double hours = minutes / 60.0;
        if (hours < 48) return String.format(Locale.ROOT, "%.1f hours", hours);
        return String.format(Locale.ROOT, "%.1f days", hours / 24.0);
    }
}
