package com.sensorplatform.common.synthetic;

/**
 * Shapes produced by {@link SyntheticSignalGenerator}.
 */
public enum SignalType {

    /** Sinusoid with low noise. */
    NORMAL,

    /** Sinusoid with low noise and a rising linear drift. */
    DRIFTING,

    /** Sinusoid buried in heavy noise. */
    NOISY,

    /** Sinusoid with a superimposed fast oscillation. */
    OSCILLATION;

    public static SignalType fromName(String name) {
        for (SignalType t : values()) {
            if (t.name().equalsIgnoreCase(name)) return t;
        }
        throw new IllegalArgumentException("Invalid signal type: " + name);
    }
}
