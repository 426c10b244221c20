package com.sensorplatform.common.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Chronologically ordered, finite-only readings produced by the preprocessor.
 *
 * <p>Immutable: the backing array is copied on the way in and on the way out.
 * Index {@code i} is the implicit time axis used by every descriptor calculator.
 */
public final class CleanSeries {

    private static final CleanSeries EMPTY = new CleanSeries(new double[0]);

    private final double[] values;

    private CleanSeries(double[] values) {
        this.values = values;
    }

    /**
     * Wraps already-validated values. Callers outside the preprocessor should go
     * through {@code SignalPreprocessor.clean(...)} instead.
     *
     * @throws IllegalArgumentException if any value is NaN or infinite
     */
    public static CleanSeries of(double... values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("CleanSeries accepts finite values only, got " + v);
            }
        }
        return new CleanSeries(values.clone());
    }

    public static CleanSeries empty() {
        return EMPTY;
    }

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    public double get(int index) {
        return values[index];
    }

    public double last() {
        if (values.length == 0) throw new IllegalStateException("empty series has no last value");
        return values[values.length - 1];
    }

    /** Defensive copy of the readings. */
    public double[] toArray() {
        return values.clone();
    }

    public List<Double> toList() {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) list.add(v);
        return Collections.unmodifiableList(list);
    }

    public double min() {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) min = Math.min(min, v);
        return values.length == 0 ? 0.0 : min;
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) max = Math.max(max, v);
        return values.length == 0 ? 0.0 : max;
    }

    public double range() {
        return max() - min();
    }

    public double mean() {
        if (values.length == 0) return 0.0;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Population standard deviation. */
    public double std() {
        if (values.length == 0) return 0.0;
        double mean = mean();
        double sq = 0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / values.length);
    }

    /** True when every reading is identical (zero variance), including the empty series. */
    public boolean isFlat() {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CleanSeries other)) return false;
        return Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "CleanSeries[size=" + values.length + "]";
    }
}
