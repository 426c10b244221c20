package com.sensorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Remaining-useful-life projection.
 *
 * @param description      human-readable phrase, or {@value #NOT_AVAILABLE}
 * @param remainingSamples projected readings until the failure boundary; {@code null} when unavailable
 */
public record RulEstimate(
    @JsonProperty("description") String description,
    @JsonProperty("remaining_samples") Double remainingSamples
) {
    public static final String NOT_AVAILABLE = "N/A";

    public static RulEstimate notAvailable() {
        return new RulEstimate(NOT_AVAILABLE, null);
    }

    @JsonIgnore
    public boolean isAvailable() {
        return remainingSamples != null;
    }

    @Override
    public String toString() {
        return description;
    }
}
