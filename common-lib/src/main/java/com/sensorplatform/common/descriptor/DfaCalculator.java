package com.sensorplatform.common.descriptor;

import com.sensorplatform.common.model.CleanSeries;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Long-range correlation via Detrended Fluctuation Analysis.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Mean-centre the series and integrate it into a cumulative-sum profile.</li>
 *   <li>Choose up to {@value #MAX_SCALES} logarithmically spaced window sizes from
 *       {@value #MIN_SCALE} to {@code n / 4}.</li>
 *   <li>Cut the profile into non-overlapping windows of each size (the tail that does
 *       not fill a window is ignored), remove an order-1 fit from each window and take
 *       the RMS of what remains.</li>
 *   <li>Average the window RMS values into {@code F(scale)}.</li>
 *   <li>Regress {@code log F} on {@code log scale}: the slope is the Hurst exponent,
 *       the regression R² its goodness of fit.</li>
 * </ol>
 *
 * <p>Scales whose fluctuation is zero cannot be logged and are dropped. With fewer
 * than two usable scales the series is reported as uncorrelated (Hurst 0.5, R² 0).
 * The exponent is clamped to [0, 1]; smooth oscillations that would exceed 1 are
 * reported as 1.
 */
public final class DfaCalculator {

    public static final int MIN_SCALE = 4;
    public static final int MAX_SCALES = 12;
    public static final double UNCORRELATED_HURST = 0.5;

    private DfaCalculator() {}

    /**
     * @param hurst         clamped scaling exponent
     * @param rSquared      fit quality of the log-log regression
     * @param scales        window sizes used in the regression
     * @param fluctuations  {@code F(scale)} per entry of {@code scales}
     */
    public record DfaResult(double hurst, double rSquared, List<Double> scales, List<Double> fluctuations) {
        public DfaResult {
            scales = List.copyOf(scales);
            fluctuations = List.copyOf(fluctuations);
        }

        static DfaResult uncorrelated() {
            return new DfaResult(UNCORRELATED_HURST, 0.0, List.of(), List.of());
        }
    }

    public static DfaResult compute(CleanSeries series) {
        int n = series.size();
        if (series.isFlat() || n / 4 < MIN_SCALE) return DfaResult.uncorrelated();

        double[] profile = profile(series);
        List<Double> scales = new ArrayList<>();
        List<Double> fluctuations = new ArrayList<>();
        for (int scale : logSpacedScales(MIN_SCALE, n / 4)) {
            double f = fluctuation(profile, scale);
            if (f > 0.0 && Double.isFinite(f)) {
                scales.add((double) scale);
                fluctuations.add(f);
            }
        }
        if (scales.size() < 2) return DfaResult.uncorrelated();

        double[] logS = new double[scales.size()];
        double[] logF = new double[scales.size()];
        for (int i = 0; i < scales.size(); i++) {
            logS[i] = Math.log(scales.get(i));
            logF[i] = Math.log(fluctuations.get(i));
        }
        LinearFit fit = LinearFit.of(logS, logF);
        double hurst = Math.max(0.0, Math.min(1.0, fit.slope()));
        return new DfaResult(hurst, fit.rSquared(), scales, fluctuations);
    }

    /**
     * Distinct integer window sizes spread evenly in log space between the bounds,
     * ascending.
     */
    static List<Integer> logSpacedScales(int minScale, int maxScale) {
        TreeSet<Integer> scales = new TreeSet<>();
        if (maxScale <= minScale) {
            scales.add(minScale);
            return new ArrayList<>(scales);
        }
        double logMin = Math.log(minScale);
        double step = (Math.log(maxScale) - logMin) / (MAX_SCALES - 1);
        for (int k = 0; k < MAX_SCALES; k++) {
            int s = (int) Math.round(Math.exp(logMin + k * step));
            scales.add(Math.max(minScale, Math.min(maxScale, s)));
        }
        return new ArrayList<>(scales);
    }

    private static double[] profile(CleanSeries series) {
        double mean = series.mean();
        double[] profile = new double[series.size()];
        double running = 0;
        for (int i = 0; i < profile.length; i++) {
            running += series.get(i) - mean;
            profile[i] = running;
        }
        return profile;
    }

    /** Mean RMS of the locally detrended profile over all full windows of {@code scale}. */
    private static double fluctuation(double[] profile, int scale) {
        int windows = profile.length / scale;
        if (windows == 0) return 0.0;

        double total = 0;
        for (int w = 0; w < windows; w++) {
            int from = w * scale;
            LinearFit local = LinearFit.ofIndex(profile, from, scale);
            double sq = 0;
            for (int i = 0; i < scale; i++) {
                double r = profile[from + i] - local.valueAt(i);
                sq += r * r;
            }
            total += Math.sqrt(sq / scale);
        }
        return total / windows;
    }
}
