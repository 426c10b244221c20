package com.sensorplatform.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sensorplatform.common.engine.SensorHealthAnalyzer;
import com.sensorplatform.common.model.AnalysisConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AnalysisEngineConfig {

    @Value("${analysis.defaults.slope-critical:0.1}")
    private double slopeCritical;

    @Value("${analysis.defaults.slope-warning:0.05}")
    private double slopeWarning;

    @Value("${analysis.defaults.bias-critical:2.0}")
    private double biasCritical;

    @Value("${analysis.defaults.bias-warning:1.0}")
    private double biasWarning;

    @Value("${analysis.defaults.noise-critical:1.5}")
    private double noiseCritical;

    @Value("${analysis.defaults.hysteresis-critical:0.5}")
    private double hysteresisCritical;

    @Value("${analysis.defaults.dfa-critical:0.8}")
    private double dfaCritical;

    @Value("${analysis.defaults.min-data-points:50}")
    private int minDataPoints;

    @Value("${analysis.defaults.bias-reference:0.0}")
    private double biasReference;

    @Value("${analysis.defaults.rul-drift-limit:10.0}")
    private double rulDriftLimit;

    @Value("${analysis.defaults.sample-interval-seconds:1.0}")
    private double sampleIntervalSeconds;

    /** Service-wide thresholds; a request may still override them per call. */
    @Bean
    public AnalysisConfig defaultAnalysisConfig() {
        return AnalysisConfig.builder()
            .slopeCritical(slopeCritical)
            .slopeWarning(slopeWarning)
            .biasCritical(biasCritical)
            .biasWarning(biasWarning)
            .noiseCritical(noiseCritical)
            .hysteresisCritical(hysteresisCritical)
            .dfaCritical(dfaCritical)
            .minDataPoints(minDataPoints)
            .biasReference(biasReference)
            .rulDriftLimit(rulDriftLimit)
            .sampleIntervalSeconds(sampleIntervalSeconds)
            .build();
    }

    @Bean
    public SensorHealthAnalyzer sensorHealthAnalyzer(AnalysisConfig defaultAnalysisConfig) {
        return new SensorHealthAnalyzer(defaultAnalysisConfig);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
