package com.sensorplatform.analysis.service;

import com.sensorplatform.analysis.exception.TransientAnalysisException;
import com.sensorplatform.analysis.logger.AnalysisFlowLogger;
import com.sensorplatform.analysis.model.AnalysisOutcome;
import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.analysis.store.ReadingQuery;
import com.sensorplatform.analysis.store.ReadingStore;
import com.sensorplatform.common.descriptor.DfaCalculator;
import com.sensorplatform.common.engine.SensorHealthAnalyzer;
import com.sensorplatform.common.exception.SensorAnalysisException;
import com.sensorplatform.common.exception.SensorAnalysisException.ErrorKind;
import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.model.CleanSeries;
import com.sensorplatform.common.model.SeriesStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs engine work off the request threads.
 *
 * <p>Each task is a fresh {@link Mono}: the series is obtained (from the request or
 * the {@link ReadingStore}), the synchronous engine runs on
 * {@link Schedulers#boundedElastic()}, and the task completes with an
 * {@link AnalysisOutcome}. Store outages and timeouts are retried with
 * exponential backoff and jitter; invalid input and numeric faults fail on the
 * first attempt. A task never terminates with an error signal.
 */
@Service
public class AnalysisTaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AnalysisTaskDispatcher.class);

    private final SensorHealthAnalyzer analyzer;
    private final ReadingStore         readingStore;
    private final AnalysisFlowLogger   flowLogger;
    private final Clock                clock;
    private final int                  maxRetries;
    private final Duration             initialBackoff;
    private final Duration             maxBackoff;
    private final Duration             fetchTimeout;

    @Autowired
    public AnalysisTaskDispatcher(
            SensorHealthAnalyzer analyzer,
            ReadingStore readingStore,
            AnalysisFlowLogger flowLogger,
            Clock clock,
            @Value("${analysis.retry.max-retries:3}")           int maxRetries,
            @Value("${analysis.retry.initial-backoff-ms:5000}") long initialBackoffMs,
            @Value("${analysis.retry.max-backoff-ms:60000}")    long maxBackoffMs,
            @Value("${analysis.store.fetch-timeout-ms:30000}")  long fetchTimeoutMs) {
        this.analyzer       = analyzer;
        this.readingStore   = readingStore;
        this.flowLogger     = flowLogger;
        this.clock          = clock;
        this.maxRetries     = maxRetries;
        this.initialBackoff = Duration.ofMillis(initialBackoffMs);
        this.maxBackoff     = Duration.ofMillis(maxBackoffMs);
        this.fetchTimeout   = Duration.ofMillis(fetchTimeoutMs);
    }

    // ── full analysis ──────────────────────────────────────────────────────

    /**
     * Analyses readings supplied by the caller.
     *
     * @param config per-call thresholds; {@code null} uses the analyzer's defaults
     */
    public Mono<AnalysisOutcome> submit(String sensorId, List<Double> values, AnalysisConfig config) {
        if (values == null) {
            return Mono.just(AnalysisOutcome.failure(sensorId, ErrorKind.INVALID_INPUT,
                "Reading series must not be null", 1));
        }
        return run(sensorId, Mono.just(values), config);
    }

    /**
     * Fetches the sensor's readings from the store, then analyses them. The fetch is
     * bounded by the configured timeout and retried on transient failure.
     */
    public Mono<AnalysisOutcome> submitStored(String sensorId, ReadingQuery query, AnalysisConfig config) {
        Mono<List<Double>> series = Mono.defer(() -> readingStore.fetchSeries(sensorId, query))
            .timeout(fetchTimeout);
        return run(sensorId, series, config);
    }

    private Mono<AnalysisOutcome> run(String sensorId, Mono<List<Double>> series, AnalysisConfig config) {
        AtomicInteger attempts = new AtomicInteger();

        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return series;
            })
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.SERIES_LOADED))
            .flatMap(values -> Mono.fromCallable(() -> analyzer.analyze(values, config))
                .subscribeOn(Schedulers.boundedElastic()))
            .retryWhen(retrySpec(sensorId))
            .map(output -> AnalysisOutcome.success(
                AnalysisReport.of(sensorId, clock.instant(), output), attempts.get()))
            .onErrorResume(e -> {
                Throwable cause = Exceptions.isRetryExhausted(e) && e.getCause() != null ? e.getCause() : e;
                ErrorKind kind = cause instanceof SensorAnalysisException sae
                    ? sae.getKind() : ErrorKind.COMPUTATION_FAILURE;
                if (kind == ErrorKind.INVALID_INPUT) {
                    log.warn("Analysis rejected. sensorId={} reason={}", sensorId, cause.getMessage());
                } else {
                    log.error("Analysis failed. sensorId={} attempts={}", sensorId, attempts.get(), cause);
                }
                return Mono.just(AnalysisOutcome.failure(sensorId, kind, describe(cause), attempts.get()));
            });
    }

    private Retry retrySpec(String sensorId) {
        return Retry.backoff(maxRetries, initialBackoff)
            .maxBackoff(maxBackoff)
            .jitter(0.5)
            .filter(AnalysisTaskDispatcher::isRetryable)
            .doBeforeRetry(signal -> log.warn("Retrying analysis. sensorId={} retry={}/{} cause={}",
                sensorId, signal.totalRetries() + 1, maxRetries, signal.failure().toString()));
    }

    static boolean isRetryable(Throwable e) {
        return e instanceof TransientAnalysisException || e instanceof TimeoutException;
    }

    /** Failure text without the kind prefix, which the outcome carries separately. */
    static String describe(Throwable e) {
        if (e instanceof SensorAnalysisException sae && sae.getDetail() != null) {
            return sae.getDetail();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // ── standalone tasks ───────────────────────────────────────────────────

    /** DFA on its own; a series too short for two scales reports Hurst 0.5. */
    public Mono<DfaCalculator.DfaResult> calculateDfa(List<Double> values) {
        return Mono.fromCallable(() -> analyzer.dfa(analyzer.preprocess(values)))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(r -> log.info("DFA calculated. hurst={} r2={} scales={}",
                                       r.hurst(), r.rSquared(), r.scales().size()));
    }

    /**
     * Descriptive statistics of the cleaned readings.
     *
     * @throws SensorAnalysisException INVALID_INPUT (as an error signal) if no valid reading remains
     */
    public Mono<SeriesStatistics> calculateStatistics(List<Double> values) {
        return Mono.fromCallable(() -> {
                CleanSeries series = analyzer.preprocess(values);
                if (series.isEmpty()) {
                    throw SensorAnalysisException.invalidInput("No valid readings to summarise");
                }
                return analyzer.statistics(series);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(s -> log.info("Statistics calculated. count={} mean={}", s.count(), s.mean()));
    }
}
