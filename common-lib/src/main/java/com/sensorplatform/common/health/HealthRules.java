package com.sensorplatform.common.health;

import java.util.List;
import java.util.Locale;

/**
 * Default rule table of the health scorer.
 *
 * <pre>
 *   flag                 severity  deduction  fires when
 *   HIGH_DRIFT           CRITICAL  30         |slope| > slope_critical
 *   EXCESSIVE_NOISE      CRITICAL  25         noise_std > noise_critical
 *   HIGH_BIAS            CRITICAL  20         |bias| > bias_critical
 *   DRIFT_WARNING        WARNING   15         slope_warning < |slope| <= slope_critical
 *   HYSTERESIS_DETECTED  WARNING   10         |hysteresis| > hysteresis_critical
 *   BIAS_WARNING         WARNING    5         bias_warning < |bias| <= bias_critical
 *   PERSISTENT_TREND     WARNING    5         hurst > dfa_critical
 * </pre>
 *
 * Warning and critical bands of the same descriptor are disjoint, so at most one
 * of them fires.
 */
public final class HealthRules {

    public static final String HIGH_DRIFT = "HIGH_DRIFT";
    public static final String EXCESSIVE_NOISE = "EXCESSIVE_NOISE";
    public static final String HIGH_BIAS = "HIGH_BIAS";
    public static final String DRIFT_WARNING = "DRIFT_WARNING";
    public static final String HYSTERESIS_DETECTED = "HYSTERESIS_DETECTED";
    public static final String BIAS_WARNING = "BIAS_WARNING";
    public static final String PERSISTENT_TREND = "PERSISTENT_TREND";

    public static final HealthRule HIGH_DRIFT_RULE = new HealthRule(
        HIGH_DRIFT, Severity.CRITICAL, 30,
        (b, c) -> Math.abs(b.slope()) > c.slopeCritical(),
        b -> format("Critical drift: readings trending at %.4f units per sample", b.slope()),
        "Recalibrate the sensor and inspect it for degradation or fouling");

    public static final HealthRule EXCESSIVE_NOISE_RULE = new HealthRule(
        EXCESSIVE_NOISE, Severity.CRITICAL, 25,
        (b, c) -> b.noiseStd() > c.noiseCritical(),
        b -> format("Excessive signal noise (noise std %.3f, SNR %.1f dB)", b.noiseStd(), b.snrDb()),
        "Check wiring, grounding and shielding for electrical interference");

    public static final HealthRule HIGH_BIAS_RULE = new HealthRule(
        HIGH_BIAS, Severity.CRITICAL, 20,
        (b, c) -> Math.abs(b.bias()) > c.biasCritical(),
        b -> format("Significant steady-state offset (bias %.3f)", b.bias()),
        "Perform an offset calibration against a reference standard");

    public static final HealthRule DRIFT_WARNING_RULE = new HealthRule(
        DRIFT_WARNING, Severity.WARNING, 15,
        (b, c) -> Math.abs(b.slope()) > c.slopeWarning() && Math.abs(b.slope()) <= c.slopeCritical(),
        b -> format("Moderate drift developing (slope %.4f units per sample)", b.slope()),
        "Schedule a calibration check and keep monitoring the drift rate");

    public static final HealthRule HYSTERESIS_RULE = new HealthRule(
        HYSTERESIS_DETECTED, Severity.WARNING, 10,
        (b, c) -> Math.abs(b.hysteresis()) > c.hysteresisCritical(),
        b -> format("Path-dependent response detected (hysteresis ratio %.3f)", b.hysteresis()),
        "Inspect mechanical parts for friction, backlash or sticking");

    public static final HealthRule BIAS_WARNING_RULE = new HealthRule(
        BIAS_WARNING, Severity.WARNING, 5,
        (b, c) -> Math.abs(b.bias()) > c.biasWarning() && Math.abs(b.bias()) <= c.biasCritical(),
        b -> format("Minor offset from reference (bias %.3f)", b.bias()),
        "Verify the offset during the next scheduled maintenance");

    public static final HealthRule PERSISTENT_TREND_RULE = new HealthRule(
        PERSISTENT_TREND, Severity.WARNING, 5,
        (b, c) -> b.hurst() > c.dfaCritical(),
        b -> format("Persistent long-range trend (Hurst exponent %.2f)", b.hurst()),
        "Watch for slow process change or sensor ageing");

    private static final List<HealthRule> DEFAULTS = List.of(
        HIGH_DRIFT_RULE,
        EXCESSIVE_NOISE_RULE,
        HIGH_BIAS_RULE,
        DRIFT_WARNING_RULE,
        HYSTERESIS_RULE,
        BIAS_WARNING_RULE,
        PERSISTENT_TREND_RULE);

    private HealthRules() {}

    public static List<HealthRule> defaults() {
        return DEFAULTS;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
