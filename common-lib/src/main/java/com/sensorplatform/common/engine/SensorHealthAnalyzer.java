package com.sensorplatform.common.engine;

import com.sensorplatform.common.descriptor.BiasCalculator;
import com.sensorplatform.common.descriptor.DescriptorExtractor;
import com.sensorplatform.common.descriptor.DfaCalculator;
import com.sensorplatform.common.descriptor.HysteresisCalculator;
import com.sensorplatform.common.descriptor.NoiseCalculator;
import com.sensorplatform.common.descriptor.SlopeCalculator;
import com.sensorplatform.common.descriptor.SummaryStatistics;
import com.sensorplatform.common.descriptor.TrendCalculator;
import com.sensorplatform.common.exception.InsufficientDataException;
import com.sensorplatform.common.exception.SensorAnalysisException;
import com.sensorplatform.common.health.HealthScorer;
import com.sensorplatform.common.health.RulEstimator;
import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.model.AnalysisOutput;
import com.sensorplatform.common.model.CleanSeries;
import com.sensorplatform.common.model.DescriptorBundle;
import com.sensorplatform.common.model.HealthAssessment;
import com.sensorplatform.common.model.RulEstimate;
import com.sensorplatform.common.model.SeriesStatistics;
import com.sensorplatform.common.preprocess.SignalPreprocessor;

import java.util.List;
import java.util.Objects;

/**
 * Facade over the sensor-health pipeline:
 * <pre>
 *   raw series → clean series → descriptor bundle → health assessment + RUL
 * </pre>
 *
 * <p>An analyzer is a plain value parameterized by its {@link AnalysisConfig}; it
 * has no identity beyond that config and holds no mutable state, so one instance
 * may be shared freely across threads or created per call.
 *
 * <p>Every descriptor is also exposed on its own. Those methods delegate to the
 * same calculator the full {@link #analyze} pass uses, so a caller that only
 * needs a slope gets exactly the slope the full analysis would report.
 *
 * <p>No Spring dependencies. No I/O. No clock. No randomness.
 */
public final class SensorHealthAnalyzer {

    private final AnalysisConfig config;
    private final HealthScorer scorer;

    public SensorHealthAnalyzer() {
        this(AnalysisConfig.defaults());
    }

    public SensorHealthAnalyzer(AnalysisConfig config) {
        this(config, HealthScorer.withDefaultRules());
    }

    public SensorHealthAnalyzer(AnalysisConfig config, HealthScorer scorer) {
        this.config = Objects.requireNonNull(config, "config");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public AnalysisConfig config() {
        return config;
    }

    /** Same scoring rules, different thresholds. */
    public SensorHealthAnalyzer withConfig(AnalysisConfig newConfig) {
        return new SensorHealthAnalyzer(newConfig, scorer);
    }

    // ── full pipeline ──────────────────────────────────────────────────────

    public AnalysisOutput analyze(List<Double> raw) {
        return analyze(raw, config);
    }

    /**
     * Runs the full pipeline with an explicit config for this call only.
     *
     * <p>If fewer than {@link AnalysisConfig#effectiveMinimum()} valid readings
     * remain after preprocessing, returns {@link AnalysisOutput#noData()} without
     * running any calculator.
     *
     * @param raw       chronological readings; {@code null}/non-finite entries are dropped
     * @param callConfig thresholds for this call; {@code null} uses this analyzer's config
     * @throws SensorAnalysisException INVALID_INPUT for a null series,
     *         COMPUTATION_FAILURE for an unexpected internal fault
     */
    public AnalysisOutput analyze(List<Double> raw, AnalysisConfig callConfig) {
        AnalysisConfig effective = callConfig != null ? callConfig : config;

        CleanSeries series;
        try {
            series = SignalPreprocessor.clean(raw, effective.effectiveMinimum());
        } catch (InsufficientDataException e) {
            return AnalysisOutput.noData();
        }

        try {
            DescriptorBundle descriptors = DescriptorExtractor.extract(series, effective.biasReference());
            HealthAssessment health = scorer.score(descriptors, effective);
            RulEstimate rul = RulEstimator.estimate(series, descriptors.slope(), effective);
            return new AnalysisOutput(descriptors, health, rul);
        } catch (SensorAnalysisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw SensorAnalysisException.computationFailure(
                "Analysis failed for series of " + series.size() + " readings", e);
        }
    }

    // ── individual stages ──────────────────────────────────────────────────

    public CleanSeries preprocess(List<Double> raw) {
        return SignalPreprocessor.clean(raw);
    }

    /** All descriptors of an already-cleaned series, without scoring. */
    public DescriptorBundle describe(CleanSeries series) {
        return DescriptorExtractor.extract(series, config.biasReference());
    }

    public double bias(CleanSeries series) {
        return BiasCalculator.compute(series, config.biasReference());
    }

    public double slope(CleanSeries series) {
        return SlopeCalculator.compute(series);
    }

    public NoiseCalculator.NoiseResult noise(CleanSeries series) {
        return NoiseCalculator.compute(series);
    }

    public HysteresisCalculator.HysteresisResult hysteresis(CleanSeries series) {
        return HysteresisCalculator.compute(series);
    }

    public DfaCalculator.DfaResult dfa(CleanSeries series) {
        return DfaCalculator.compute(series);
    }

    public TrendCalculator.TrendResult trend(CleanSeries series) {
        return TrendCalculator.compute(series);
    }

    public SeriesStatistics statistics(CleanSeries series) {
        return SummaryStatistics.compute(series);
    }

    public HealthAssessment score(DescriptorBundle bundle) {
        return scorer.score(bundle, config);
    }

    public RulEstimate estimateRul(CleanSeries series, double slope) {
        return RulEstimator.estimate(series, slope, config);
    }
}
