package com.sensorplatform.common.preprocess;

import com.sensorplatform.common.exception.InsufficientDataException;
import com.sensorplatform.common.exception.SensorAnalysisException;
import com.sensorplatform.common.model.CleanSeries;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Turns a raw reading sequence into a {@link CleanSeries}.
 *
 * <p>Missing ({@code null}) and non-finite (NaN, ±∞) readings are dropped; the
 * order of the remaining readings is preserved. Chronological order is the
 * caller's responsibility. Pure, no side effects.
 */
public final class SignalPreprocessor {

    private SignalPreprocessor() {}

    /**
     * Drops invalid markers.
     *
     * @param raw chronological readings; {@code null} entries are allowed
     * @return cleaned series, possibly empty
     * @throws SensorAnalysisException INVALID_INPUT if {@code raw} itself is null
     */
    public static CleanSeries clean(List<Double> raw) {
        if (raw == null) {
            throw SensorAnalysisException.invalidInput("Reading series must not be null");
        }
        double[] buffer = new double[raw.size()];
        int n = 0;
        for (Double v : raw) {
            if (v != null && Double.isFinite(v)) buffer[n++] = v;
        }
        return CleanSeries.of(Arrays.copyOf(buffer, n));
    }

    /**
     * Drops invalid markers and enforces a minimum length.
     *
     * @throws InsufficientDataException if fewer than {@code minimum} readings survive
     */
    public static CleanSeries clean(List<Double> raw, int minimum) {
        CleanSeries series = clean(raw);
        if (series.size() < minimum) {
            throw new InsufficientDataException(series.size(), minimum);
        }
        return series;
    }

    /**
     * Validates an untyped payload (queued task arguments, decoded JSON) into a raw
     * series. Accepts a collection or array of numbers, where {@code null} marks a
     * missing reading.
     *
     * @throws SensorAnalysisException INVALID_INPUT on a null payload, a non-sequence
     *         shape, a nested sequence or a non-numeric entry
     */
    public static List<Double> toRawSeries(Object payload) {
        if (payload == null) {
            throw SensorAnalysisException.invalidInput("Reading series must not be null");
        }
        if (payload instanceof double[] primitives) {
            List<Double> out = new ArrayList<>(primitives.length);
            for (double v : primitives) out.add(v);
            return out;
        }
        Collection<?> items;
        if (payload instanceof Collection<?> c) {
            items = c;
        } else if (payload instanceof Object[] array) {
            items = Arrays.asList(array);
        } else {
            throw SensorAnalysisException.invalidInput(
                "Reading series must be a sequence of numbers, got " + payload.getClass().getSimpleName());
        }

        List<Double> out = new ArrayList<>(items.size());
        int index = 0;
        for (Object item : items) {
            if (item == null) {
                out.add(null);
            } else if (item instanceof Number n) {
                out.add(n.doubleValue());
            } else {
                throw SensorAnalysisException.invalidInput(
                    "Reading at index " + index + " is not numeric: " + item.getClass().getSimpleName());
            }
            index++;
        }
        return out;
    }
}
