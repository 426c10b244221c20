package com.sensorplatform.analysis.service;

import com.sensorplatform.analysis.logger.AnalysisFlowLogger;
import com.sensorplatform.analysis.model.AnalysisOutcome;
import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.analysis.store.ReadingQuery;
import com.sensorplatform.analysis.store.ReadingStore;
import com.sensorplatform.analysis.store.ResultStore;
import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Request-level analysis flow: resolve the series, dispatch the engine, persist
 * the report.
 *
 * <p>Persistence is best effort. A result-store failure is logged and the caller
 * still receives the computed report. "No Data" reports are returned but never
 * stored.
 */
@Service
public class SensorAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(SensorAnalysisService.class);

    /** Fewest stored readings the background pass will bother analysing. */
    static final int BACKGROUND_MIN_READINGS = 10;

    private final AnalysisTaskDispatcher dispatcher;
    private final ReadingStore           readingStore;
    private final ResultStore            resultStore;
    private final AnalysisFlowLogger     flowLogger;
    private final Clock                  clock;
    private final int                    defaultWindowSize;
    private final int                    maxPoints;

    @Autowired
    public SensorAnalysisService(
            AnalysisTaskDispatcher dispatcher,
            ReadingStore readingStore,
            ResultStore resultStore,
            AnalysisFlowLogger flowLogger,
            Clock clock,
            @Value("${analysis.window.default-size:1000}") int defaultWindowSize,
            @Value("${analysis.window.max-points:10000}")  int maxPoints) {
        this.dispatcher        = dispatcher;
        this.readingStore      = readingStore;
        this.resultStore       = resultStore;
        this.flowLogger        = flowLogger;
        this.clock             = clock;
        this.defaultWindowSize = defaultWindowSize;
        this.maxPoints         = maxPoints;
    }

    // ── analysis ───────────────────────────────────────────────────────────

    public Mono<AnalysisReport> analyzeValues(String sensorId, List<Double> values, AnalysisConfig config) {
        return dispatcher.submit(sensorId, values, config)
            .flatMap(this::unwrap)
            .flatMap(this::persistQuietly);
    }

    public Mono<AnalysisReport> analyzeStored(String sensorId, ReadingQuery query, AnalysisConfig config) {
        return dispatcher.submitStored(sensorId, query, config)
            .flatMap(this::unwrap)
            .flatMap(this::persistQuietly);
    }

    /**
     * Builds the store query for a request without inline values: an explicit range
     * when either bound is given, otherwise the latest window. Both are capped at
     * the configured maximum.
     *
     * @param windowSize requested window; {@code null} or non-positive takes the default
     */
    public ReadingQuery resolveQuery(Instant from, Instant to, Integer windowSize) {
        if (from != null || to != null) {
            return ReadingQuery.between(from, to, maxPoints);
        }
        int window = windowSize != null && windowSize > 0 ? windowSize : defaultWindowSize;
        return ReadingQuery.latest(Math.min(window, maxPoints));
    }

    /** Newest reports first. */
    public Flux<AnalysisReport> history(String sensorId, int limit) {
        return resultStore.history(sensorId, limit);
    }

    /**
     * Saves the report unless it is a "No Data" placeholder. Never fails: a store
     * error is logged and the report is passed through.
     */
    public Mono<AnalysisReport> persistQuietly(AnalysisReport report) {
        if (!report.hasData()) {
            return Mono.just(report);
        }
        return resultStore.save(report)
            .doOnEach(flowLogger.stage(AnalysisFlowLogger.RESULT_PERSISTED))
            .onErrorResume(e -> {
                log.error("Failed to save analysis result. sensorId={}", report.sensorId(), e);
                return Mono.just(report);
            });
    }

    // ── ingest ─────────────────────────────────────────────────────────────

    /**
     * Stores one reading and kicks off a background re-analysis of the sensor. The
     * returned Mono completes once the reading is stored; the analysis runs
     * detached and only logs its outcome.
     */
    public Mono<Instant> ingestReading(String sensorId, Double value, Instant timestamp) {
        Instant recordedAt = timestamp != null ? timestamp : clock.instant();
        return readingStore.append(sensorId, value, recordedAt)
            .then(Mono.fromRunnable(() -> triggerBackgroundAnalysis(sensorId)))
            .thenReturn(recordedAt);
    }

    void triggerBackgroundAnalysis(String sensorId) {
        String traceId = UUID.randomUUID().toString();
        flowLogger.logWithTraceId(AnalysisFlowLogger.REQUEST_RECEIVED, sensorId, traceId);

        TraceContextUtil.withTraceId(backgroundAnalysis(sensorId), traceId)
            .subscribe(
                report -> flowLogger.logReport(report, traceId),
                e -> log.error("Background analysis failed. sensorId={} traceId={}", sensorId, traceId, e)
            );
    }

    Mono<AnalysisReport> backgroundAnalysis(String sensorId) {
        return readingStore.fetchSeries(sensorId, ReadingQuery.latest(Math.min(defaultWindowSize, maxPoints)))
            .flatMap(values -> {
                if (values.size() < BACKGROUND_MIN_READINGS) {
                    log.info("Not enough readings for background analysis. sensorId={} count={}",
                             sensorId, values.size());
                    return Mono.empty();
                }
                return dispatcher.submit(sensorId, values, null)
                    .flatMap(this::unwrap)
                    .flatMap(this::persistQuietly);
            });
    }

    private Mono<AnalysisReport> unwrap(AnalysisOutcome outcome) {
        return outcome.success() ? Mono.just(outcome.report()) : Mono.error(outcome.toException());
    }
}
