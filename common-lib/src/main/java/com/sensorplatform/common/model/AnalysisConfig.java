package com.sensorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensorplatform.common.exception.SensorAnalysisException;

import java.util.Map;
import java.util.Set;

/**
 * Named classification thresholds supplied per analysis call.
 *
 * <p>Thresholds alter classification only, never descriptor math. Every field has a
 * documented default; a {@code null} argument to {@link #of} or a missing key in
 * {@link #fromMap} takes that default. Unknown keys are rejected rather than
 * ignored, so a misspelled threshold can never pass as valid configuration.
 *
 * <h3>Fields</h3>
 * <ul>
 *   <li>{@code slope_critical} / {@code slope_warning} : drift rate per sample</li>
 *   <li>{@code bias_critical} / {@code bias_warning} : offset from {@code bias_reference}</li>
 *   <li>{@code noise_critical} : residual noise standard deviation</li>
 *   <li>{@code hysteresis_critical} : normalized loop area</li>
 *   <li>{@code dfa_critical} : Hurst exponent above which a trend is persistent</li>
 *   <li>{@code min_data_points} : preprocessing minimum (never below {@value #ABSOLUTE_MIN_POINTS})</li>
 *   <li>{@code bias_reference} : level the bias is measured from</li>
 *   <li>{@code rul_drift_limit} : distance from the trend baseline treated as the failure boundary</li>
 *   <li>{@code sample_interval_seconds} : time between readings, used to phrase RUL</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public record AnalysisConfig(
    @JsonProperty("slope_critical") double slopeCritical,
    @JsonProperty("slope_warning") double slopeWarning,
    @JsonProperty("bias_critical") double biasCritical,
    @JsonProperty("bias_warning") double biasWarning,
    @JsonProperty("noise_critical") double noiseCritical,
    @JsonProperty("hysteresis_critical") double hysteresisCritical,
    @JsonProperty("dfa_critical") double dfaCritical,
    @JsonProperty("min_data_points") int minDataPoints,
    @JsonProperty("bias_reference") double biasReference,
    @JsonProperty("rul_drift_limit") double rulDriftLimit,
    @JsonProperty("sample_interval_seconds") double sampleIntervalSeconds
) {

    /** Below this many readings no descriptor is computed, whatever the configuration says. */
    public static final int ABSOLUTE_MIN_POINTS = 5;

    public static final double DEFAULT_SLOPE_CRITICAL = 0.1;
    public static final double DEFAULT_SLOPE_WARNING = 0.05;
    public static final double DEFAULT_BIAS_CRITICAL = 2.0;
    public static final double DEFAULT_BIAS_WARNING = 1.0;
    public static final double DEFAULT_NOISE_CRITICAL = 1.5;
    public static final double DEFAULT_HYSTERESIS_CRITICAL = 0.5;
    public static final double DEFAULT_DFA_CRITICAL = 0.8;
    public static final int DEFAULT_MIN_DATA_POINTS = 50;
    public static final double DEFAULT_BIAS_REFERENCE = 0.0;
    public static final double DEFAULT_RUL_DRIFT_LIMIT = 10.0;
    public static final double DEFAULT_SAMPLE_INTERVAL_SECONDS = 1.0;

    private static final AnalysisConfig DEFAULTS = new AnalysisConfig(
        DEFAULT_SLOPE_CRITICAL, DEFAULT_SLOPE_WARNING,
        DEFAULT_BIAS_CRITICAL, DEFAULT_BIAS_WARNING,
        DEFAULT_NOISE_CRITICAL, DEFAULT_HYSTERESIS_CRITICAL, DEFAULT_DFA_CRITICAL,
        DEFAULT_MIN_DATA_POINTS, DEFAULT_BIAS_REFERENCE,
        DEFAULT_RUL_DRIFT_LIMIT, DEFAULT_SAMPLE_INTERVAL_SECONDS);

    private static final Set<String> KNOWN_KEYS = Set.of(
        "slope_critical", "slope_warning", "bias_critical", "bias_warning",
        "noise_critical", "hysteresis_critical", "dfa_critical", "min_data_points",
        "bias_reference", "rul_drift_limit", "sample_interval_seconds");

    public AnalysisConfig {
        requireFinite("slope_critical", slopeCritical);
        requireFinite("slope_warning", slopeWarning);
        requireFinite("bias_critical", biasCritical);
        requireFinite("bias_warning", biasWarning);
        requireFinite("noise_critical", noiseCritical);
        requireFinite("hysteresis_critical", hysteresisCritical);
        requireFinite("dfa_critical", dfaCritical);
        requireFinite("bias_reference", biasReference);
        requireFinite("rul_drift_limit", rulDriftLimit);
        requireFinite("sample_interval_seconds", sampleIntervalSeconds);

        if (slopeWarning < 0 || biasWarning < 0 || noiseCritical < 0 || hysteresisCritical < 0 || dfaCritical < 0) {
            throw SensorAnalysisException.invalidInput("Thresholds must be non-negative");
        }
        if (slopeWarning > slopeCritical) {
            throw SensorAnalysisException.invalidInput(
                "slope_warning (" + slopeWarning + ") exceeds slope_critical (" + slopeCritical + ")");
        }
        if (biasWarning > biasCritical) {
            throw SensorAnalysisException.invalidInput(
                "bias_warning (" + biasWarning + ") exceeds bias_critical (" + biasCritical + ")");
        }
        if (minDataPoints < ABSOLUTE_MIN_POINTS) {
            throw SensorAnalysisException.invalidInput(
                "min_data_points must be at least " + ABSOLUTE_MIN_POINTS + ", got " + minDataPoints);
        }
        if (rulDriftLimit <= 0) {
            throw SensorAnalysisException.invalidInput("rul_drift_limit must be positive, got " + rulDriftLimit);
        }
        if (sampleIntervalSeconds <= 0) {
            throw SensorAnalysisException.invalidInput(
                "sample_interval_seconds must be positive, got " + sampleIntervalSeconds);
        }
    }

    public static AnalysisConfig defaults() {
        return DEFAULTS;
    }

    /**
     * JSON entry point: any {@code null} argument takes its documented default.
     */
    @JsonCreator
    public static AnalysisConfig of(
            @JsonProperty("slope_critical") Double slopeCritical,
            @JsonProperty("slope_warning") Double slopeWarning,
            @JsonProperty("bias_critical") Double biasCritical,
            @JsonProperty("bias_warning") Double biasWarning,
            @JsonProperty("noise_critical") Double noiseCritical,
            @JsonProperty("hysteresis_critical") Double hysteresisCritical,
            @JsonProperty("dfa_critical") Double dfaCritical,
            @JsonProperty("min_data_points") Integer minDataPoints,
            @JsonProperty("bias_reference") Double biasReference,
            @JsonProperty("rul_drift_limit") Double rulDriftLimit,
            @JsonProperty("sample_interval_seconds") Double sampleIntervalSeconds) {
        return new AnalysisConfig(
            orDefault(slopeCritical, DEFAULT_SLOPE_CRITICAL),
            orDefault(slopeWarning, DEFAULT_SLOPE_WARNING),
            orDefault(biasCritical, DEFAULT_BIAS_CRITICAL),
            orDefault(biasWarning, DEFAULT_BIAS_WARNING),
            orDefault(noiseCritical, DEFAULT_NOISE_CRITICAL),
            orDefault(hysteresisCritical, DEFAULT_HYSTERESIS_CRITICAL),
            orDefault(dfaCritical, DEFAULT_DFA_CRITICAL),
            minDataPoints != null ? minDataPoints : DEFAULT_MIN_DATA_POINTS,
            orDefault(biasReference, DEFAULT_BIAS_REFERENCE),
            orDefault(rulDriftLimit, DEFAULT_RUL_DRIFT_LIMIT),
            orDefault(sampleIntervalSeconds, DEFAULT_SAMPLE_INTERVAL_SECONDS));
    }

    /**
     * Builds a config from an untyped key/value payload over the built-in defaults.
     *
     * @see #fromMap(AnalysisConfig, Map)
     */
    public static AnalysisConfig fromMap(Map<String, ?> values) {
        return fromMap(DEFAULTS, values);
    }

    /**
     * Lays an untyped key/value payload, as carried by requests and queued tasks,
     * over {@code base}. Keys that are absent or mapped to {@code null} keep the
     * base value.
     *
     * @param base   config the payload overrides
     * @param values snake_case field names to numbers; {@code null} or empty yields {@code base}
     * @throws SensorAnalysisException INVALID_INPUT on an unknown key, a non-numeric value
     *         or a combination that fails validation
     */
    public static AnalysisConfig fromMap(AnalysisConfig base, Map<String, ?> values) {
        if (values == null || values.isEmpty()) return base;

        for (String key : values.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                throw SensorAnalysisException.invalidInput("Unknown configuration field: " + key);
            }
        }
        Number minPoints = number(values, "min_data_points");
        if (minPoints != null && minPoints.doubleValue() != Math.rint(minPoints.doubleValue())) {
            throw SensorAnalysisException.invalidInput("min_data_points must be an integer, got " + minPoints);
        }
        return new AnalysisConfig(
            orDefault(doubleOrNull(values, "slope_critical"), base.slopeCritical),
            orDefault(doubleOrNull(values, "slope_warning"), base.slopeWarning),
            orDefault(doubleOrNull(values, "bias_critical"), base.biasCritical),
            orDefault(doubleOrNull(values, "bias_warning"), base.biasWarning),
            orDefault(doubleOrNull(values, "noise_critical"), base.noiseCritical),
            orDefault(doubleOrNull(values, "hysteresis_critical"), base.hysteresisCritical),
            orDefault(doubleOrNull(values, "dfa_critical"), base.dfaCritical),
            minPoints != null ? minPoints.intValue() : base.minDataPoints,
            orDefault(doubleOrNull(values, "bias_reference"), base.biasReference),
            orDefault(doubleOrNull(values, "rul_drift_limit"), base.rulDriftLimit),
            orDefault(doubleOrNull(values, "sample_interval_seconds"), base.sampleIntervalSeconds));
    }

    public static Builder builder() {
        return new Builder(DEFAULTS);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /** Effective minimum series length for full analysis. */
    public int effectiveMinimum() {
        return Math.max(ABSOLUTE_MIN_POINTS, minDataPoints);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw SensorAnalysisException.invalidInput(name + " must be a finite number, got " + value);
        }
    }

    private static Number number(Map<String, ?> values, String key) {
        Object raw = values.get(key);
        if (raw == null) return null;
        if (raw instanceof Number n) return n;
        throw SensorAnalysisException.invalidInput(
            "Configuration field " + key + " must be numeric, got " + raw.getClass().getSimpleName());
    }

    private static Double doubleOrNull(Map<String, ?> values, String key) {
        Number n = number(values, key);
        return n != null ? n.doubleValue() : null;
    }

    /**
     * Fluent copy-with-changes for tests and programmatic callers.
     */
    public static final class Builder {
        private double slopeCritical;
        private double slopeWarning;
        private double biasCritical;
        private double biasWarning;
        private double noiseCritical;
        private double hysteresisCritical;
        private double dfaCritical;
        private int minDataPoints;
        private double biasReference;
        private double rulDriftLimit;
        private double sampleIntervalSeconds;

        private Builder(AnalysisConfig base) {
            this.slopeCritical = base.slopeCritical;
            this.slopeWarning = base.slopeWarning;
            this.biasCritical = base.biasCritical;
            this.biasWarning = base.biasWarning;
            this.noiseCritical = base.noiseCritical;
            this.hysteresisCritical = base.hysteresisCritical;
            this.dfaCritical = base.dfaCritical;
            this.minDataPoints = base.minDataPoints;
            this.biasReference = base.biasReference;
            this.rulDriftLimit = base.rulDriftLimit;
            this.sampleIntervalSeconds = base.sampleIntervalSeconds;
        }

        public Builder slopeCritical(double v)         { this.slopeCritical = v; return this; }
        public Builder slopeWarning(double v)          { this.slopeWarning = v; return this; }
        public Builder biasCritical(double v)          { this.biasCritical = v; return this; }
        public Builder biasWarning(double v)           { this.biasWarning = v; return this; }
        public Builder noiseCritical(double v)         { this.noiseCritical = v; return this; }
        public Builder hysteresisCritical(double v)    { this.hysteresisCritical = v; return this; }
        public Builder dfaCritical(double v)           { this.dfaCritical = v; return this; }
        public Builder minDataPoints(int v)            { this.minDataPoints = v; return this; }
        public Builder biasReference(double v)         { this.biasReference = v; return this; }
        public Builder rulDriftLimit(double v)         { this.rulDriftLimit = v; return this; }
        public Builder sampleIntervalSeconds(double v) { this.sampleIntervalSeconds = v; return this; }

        public AnalysisConfig build() {
            return new AnalysisConfig(slopeCritical, slopeWarning, biasCritical, biasWarning,
                noiseCritical, hysteresisCritical, dfaCritical, minDataPoints,
                biasReference, rulDriftLimit, sampleIntervalSeconds);
        }
    }
}
