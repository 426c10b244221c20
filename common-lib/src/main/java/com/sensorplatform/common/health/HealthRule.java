package com.sensorplatform.common.health;

import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.model.DescriptorBundle;

import java.util.Comparator;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * One threshold check of the health scorer.
 *
 * @param flag           short code reported when the rule fires
 * @param severity       rank used to order findings
 * @param deduction      points removed from the 100 baseline
 * @param predicate      firing condition over descriptors and thresholds
 * @param diagnosis      phrasing of the finding for a given bundle
 * @param recommendation maintenance action when this is the dominant finding
 */
public record HealthRule(
    String flag,
    Severity severity,
    double deduction,
    BiPredicate<DescriptorBundle, AnalysisConfig> predicate,
    Function<DescriptorBundle, String> diagnosis,
    String recommendation
) {
    /** Most severe first; larger deduction breaks ties. */
    public static final Comparator<HealthRule> BY_SEVERITY =
        Comparator.comparing(HealthRule::severity)
                  .thenComparing(Comparator.comparingDouble(HealthRule::deduction).reversed());

    public boolean fires(DescriptorBundle bundle, AnalysisConfig config) {
        return predicate.test(bundle, config);
    }

    public String diagnose(DescriptorBundle bundle) {
        return diagnosis.apply(bundle);
    }
}
