package com.sensorplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Combined result of one {@code analyze} call.
 */
public record AnalysisOutput(
    @JsonProperty("descriptors") DescriptorBundle descriptors,
    @JsonProperty("health") HealthAssessment health,
    @JsonProperty("rul") RulEstimate rul
) {
    public static AnalysisOutput noData() {
        return new AnalysisOutput(DescriptorBundle.empty(), HealthAssessment.noData(), RulEstimate.notAvailable());
    }
}
