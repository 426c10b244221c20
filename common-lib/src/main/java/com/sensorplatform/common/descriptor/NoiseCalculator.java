package com.sensorplatform.common.descriptor;

import com.sensorplatform.common.model.CleanSeries;

/**
 * Residual noise level and signal-to-noise ratio.
 *
 * <p>Noise is the residual left after a local linear fit: each interior sample is
 * compared with the straight line through its two neighbours, which removes
 * trend and slow oscillation alike. For white noise of standard deviation σ that
 * residual has standard deviation σ·√(3/2), so the result is rescaled to σ.
 *
 * <p>This is not the spread of the global linear-fit residuals reported in the
 * descriptor bundle's {@code residuals}: those still contain any oscillation or
 * curvature around the single trend line, while this estimate does not.
 *
 * <p>{@code snr_db = 20·log10(signal_std / noise_std)}, where {@code signal_std}
 * is the population standard deviation of the readings. When noise vanishes the
 * ratio is pinned to {@value #SNR_CEILING_DB} dB.
 */
public final class NoiseCalculator {

    public static final double SNR_CEILING_DB = 100.0;

    /** Noise below this is treated as none. */
    static final double NOISE_EPSILON = 1e-12;

    private static final double WHITE_NOISE_SCALE = Math.sqrt(2.0 / 3.0);

    private NoiseCalculator() {}

    public record NoiseResult(double noiseStd, double snrDb) {}

    public static NoiseResult compute(CleanSeries series) {
        double noise = noiseStd(series);
        return new NoiseResult(noise, snrDb(series, noise));
    }

    /**
     * @return noise standard deviation; 0 for a flat series or fewer than 3 readings
     */
    public static double noiseStd(CleanSeries series) {
        int n = series.size();
        if (n < 3 || series.isFlat()) return 0.0;

        int m = n - 2;
        double[] residuals = new double[m];
        double mean = 0;
        for (int i = 1; i < n - 1; i++) {
            double r = series.get(i) - (series.get(i - 1) + series.get(i + 1)) / 2.0;
            residuals[i - 1] = r;
            mean += r;
        }
        mean /= m;

        double sq = 0;
        for (double r : residuals) {
            double d = r - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / m) * WHITE_NOISE_SCALE;
    }

    /**
     * @return SNR in dB, capped at {@value #SNR_CEILING_DB}
     */
    public static double snrDb(CleanSeries series, double noiseStd) {
        if (noiseStd < NOISE_EPSILON) return SNR_CEILING_DB;
        double amplitude = series.std();
        if (amplitude < NOISE_EPSILON) return 0.0;
        return Math.min(SNR_CEILING_DB, 20.0 * Math.log10(amplitude / noiseStd));
    }
}
