package com.sensorplatform.common.health;

import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.model.DescriptorBundle;
import com.sensorplatform.common.model.HealthAssessment;
import com.sensorplatform.common.model.HealthStatus;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Combines a descriptor bundle into a bounded health score, status, flags,
 * diagnosis and recommendation.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Start from {@value #BASELINE} points.</li>
 *   <li>Evaluate every {@link HealthRule} against the bundle and thresholds; each
 *       firing rule subtracts its deduction and contributes its flag.</li>
 *   <li>Clamp the score to [0, 100] and map it onto the status bands:
 *       {@code >= }{@value #NORMAL_FLOOR} Normal, {@code >= }{@value #WARNING_FLOOR}
 *       Warning, otherwise Critical.</li>
 *   <li>Order findings by {@link HealthRule#BY_SEVERITY}; the first one leads the
 *       diagnosis and supplies the recommendation.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe: identical bundle and config always produce an
 * identical assessment.
 */
public final class HealthScorer {

    public static final double BASELINE = 100.0;
    public static final double NORMAL_FLOOR = 85.0;
    public static final double WARNING_FLOOR = 60.0;

    static final String HEALTHY_DIAGNOSIS = "Sensor operating within normal parameters";
    static final String HEALTHY_RECOMMENDATION = "No action required; continue routine monitoring";

    private static final HealthScorer DEFAULT = new HealthScorer(HealthRules.defaults());

    private final List<HealthRule> rules;

    public HealthScorer(List<HealthRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public static HealthScorer withDefaultRules() {
        return DEFAULT;
    }

    public List<HealthRule> rules() {
        return rules;
    }

    public HealthAssessment score(DescriptorBundle bundle, AnalysisConfig config) {
        List<HealthRule> fired = new ArrayList<>();
        double score = BASELINE;
        for (HealthRule rule : rules) {
            if (rule.fires(bundle, config)) {
                fired.add(rule);
                score -= rule.deduction();
            }
        }
        score = clamp(score);
        fired.sort(HealthRule.BY_SEVERITY);

        Set<String> flags = new LinkedHashSet<>();
        for (HealthRule rule : fired) flags.add(rule.flag());

        if (fired.isEmpty()) {
            return new HealthAssessment(score, statusFor(score), HEALTHY_DIAGNOSIS, List.of(), HEALTHY_RECOMMENDATION);
        }
        HealthRule dominant = fired.get(0);
        return new HealthAssessment(score, statusFor(score), diagnosis(dominant, fired, bundle),
            List.copyOf(flags), dominant.recommendation());
    }

    public static HealthStatus statusFor(double score) {
        if (score >= NORMAL_FLOOR) return HealthStatus.NORMAL;
        if (score >= WARNING_FLOOR) return HealthStatus.WARNING;
        return HealthStatus.CRITICAL;
    }

    private static String diagnosis(HealthRule dominant, List<HealthRule> fired, DescriptorBundle bundle) {
        String lead = dominant.diagnose(bundle);
        if (fired.size() == 1) return lead;
        String secondary = fired.subList(1, fired.size()).stream()
            .map(HealthRule::flag)
            .distinct()
            .collect(Collectors.joining(", "));
        return lead + ". Secondary findings: " + secondary;
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(BASELINE, score));
    }
}
