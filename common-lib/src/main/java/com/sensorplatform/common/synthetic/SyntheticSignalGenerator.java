package com.sensorplatform.common.synthetic;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Demo and test signals on the time axis {@code t = linspace(0, 10, length)}.
 *
 * <p>The base shape is {@code 10·sin(t)}. Gaussian noise comes from a
 * {@link Random} seeded by the caller, so the same seed always yields the same
 * series.
 */
public final class SyntheticSignalGenerator {

    public static final double TIME_SPAN = 10.0;
    public static final double BASE_AMPLITUDE = 10.0;

    private SyntheticSignalGenerator() {}

    public static List<Double> generate(SignalType type, int length, long seed) {
        return switch (type) {
            case NORMAL      -> sinusoid(length, BASE_AMPLITUDE, 0.5, 0.0, seed);
            case DRIFTING    -> sinusoid(length, BASE_AMPLITUDE, 0.5, 5.0, seed);
            case NOISY       -> sinusoid(length, BASE_AMPLITUDE, 3.0, 0.0, seed);
            case OSCILLATION -> oscillation(length, seed);
        };
    }

    /**
     * {@code amplitude·sin(t) + linspace(0, driftTo) + N(0, noiseStd)}.
     */
    public static List<Double> sinusoid(int length, double amplitude, double noiseStd, double driftTo, long seed) {
        requireLength(length);
        Random random = new Random(seed);
        double[] t = timeAxis(length);
        List<Double> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            double drift = length == 1 ? 0.0 : driftTo * i / (length - 1);
            out.add(amplitude * Math.sin(t[i]) + drift + noiseStd * random.nextGaussian());
        }
        return out;
    }

    /** Base shape plus {@code 5·sin(10t)} and light noise. */
    public static List<Double> oscillation(int length, long seed) {
        requireLength(length);
        Random random = new Random(seed);
        double[] t = timeAxis(length);
        List<Double> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add(BASE_AMPLITUDE * Math.sin(t[i]) + 5.0 * Math.sin(10.0 * t[i]) + 0.2 * random.nextGaussian());
        }
        return out;
    }

    /** {@code length} evenly spaced points from 0 to {@value #TIME_SPAN} inclusive. */
    public static double[] timeAxis(int length) {
        double[] t = new double[length];
        for (int i = 0; i < length; i++) {
            t[i] = length == 1 ? 0.0 : TIME_SPAN * i / (length - 1);
        }
        return t;
    }

    private static void requireLength(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive, got " + length);
        }
    }
}
