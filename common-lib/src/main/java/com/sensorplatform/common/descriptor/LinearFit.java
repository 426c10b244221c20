package com.sensorplatform.common.descriptor;

/**
 * Ordinary least-squares line {@code y = slope·x + intercept} with its coefficient
 * of determination.
 *
 * <p>Shared by the slope, trend, RUL and DFA computations so there is exactly one
 * regression implementation in the engine.
 */
public record LinearFit(double slope, double intercept, double rSquared) {

    /**
     * Fits {@code y} against the sample index {@code 0..n-1}.
     */
    public static LinearFit ofIndex(double[] y) {
        return ofIndex(y, 0, y.length);
    }

    /**
     * Fits {@code y[from..from+length)} against the local index {@code 0..length-1}.
     * Used by DFA on each window without copying.
     */
    public static LinearFit ofIndex(double[] y, int from, int length) {
        if (length == 0) return new LinearFit(0.0, 0.0, 0.0);
        if (length == 1) return new LinearFit(0.0, y[from], 0.0);

        // closed forms for x = 0..n-1
        double n = length;
        double meanX = (n - 1) / 2.0;
        double sxx = n * (n * n - 1) / 12.0;

        double meanY = 0;
        for (int i = 0; i < length; i++) meanY += y[from + i];
        meanY /= n;

        double sxy = 0;
        double syy = 0;
        for (int i = 0; i < length; i++) {
            double dy = y[from + i] - meanY;
            sxy += (i - meanX) * dy;
            syy += dy * dy;
        }
        double slope = sxy / sxx;
        return new LinearFit(slope, meanY - slope * meanX, rSquared(sxx, sxy, syy));
    }

    /**
     * Fits {@code y} against arbitrary {@code x} (same length).
     */
    public static LinearFit of(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y differ in length: " + x.length + " vs " + y.length);
        }
        int n = x.length;
        if (n == 0) return new LinearFit(0.0, 0.0, 0.0);

        double meanX = 0;
        double meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += x[i];
            meanY += y[i];
        }
        meanX /= n;
        meanY /= n;

        double sxx = 0;
        double sxy = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxx += dx * dx;
            sxy += dx * dy;
            syy += dy * dy;
        }
        if (sxx == 0) return new LinearFit(0.0, meanY, 0.0);

        double slope = sxy / sxx;
        return new LinearFit(slope, meanY - slope * meanX, rSquared(sxx, sxy, syy));
    }

    public double valueAt(double x) {
        return slope * x + intercept;
    }

    private static double rSquared(double sxx, double sxy, double syy) {
        if (sxx == 0 || syy == 0) return 0.0;
        double r2 = (sxy * sxy) / (sxx * syy);
        return Math.max(0.0, Math.min(1.0, r2));
    }
}
