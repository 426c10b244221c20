package com.sensorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status classification derived from the bounded health score.
 *
 * <ul>
 *   <li>{@link #NORMAL}   : score at or above the normal band floor</li>
 *   <li>{@link #WARNING}  : degraded but serviceable</li>
 *   <li>{@link #CRITICAL} : attention required</li>
 *   <li>{@link #NO_DATA}  : too few valid readings to assess</li>
 * </ul>
 */
public enum HealthStatus {

    NORMAL("Normal"),
    WARNING("Warning"),
    CRITICAL("Critical"),
    NO_DATA("No Data");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static HealthStatus fromLabel(String label) {
        for (HealthStatus s : values()) {
            if (s.label.equalsIgnoreCase(label) || s.name().equalsIgnoreCase(label)) return s;
        }
        throw new IllegalArgumentException("Unknown health status: " + label);
    }
}
