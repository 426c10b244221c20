package com.sensorplatform.analysis.job;

import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.analysis.service.SensorAnalysisService;
import com.sensorplatform.analysis.store.ReadingQuery;
import com.sensorplatform.analysis.store.ReadingStore;
import com.sensorplatform.common.engine.SensorHealthAnalyzer;
import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.model.CleanSeries;
import com.sensorplatform.common.trace.TraceContextUtil;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic lightweight drift watch over a configured set of sensors.
 *
 * <p>Each sensor runs its own loop:
 * <pre>
 *   delay(interval) → fetch latest window → slope + noise only → escalate? → repeat
 * </pre>
 * Only slope and noise are computed on every cycle. When either crosses its
 * warning or critical threshold the job escalates to a full analysis, which is
 * persisted like any other. Errors are logged and the loop carries on.
 *
 * <p>Disabled unless {@code analysis.drift-watch.enabled=true}.
 */
@Component
public class DriftWatchJob {

    private static final Logger log = LoggerFactory.getLogger(DriftWatchJob.class);

    /**
     * Result of one lightweight pass.
     *
     * @param readings valid readings in the window
     * @param escalate whether a full analysis was requested
     */
    public record DriftCheck(String sensorId, int readings, double slope, double noiseStd, boolean escalate) {

        static DriftCheck skipped(String sensorId, int readings) {
            return new DriftCheck(sensorId, readings, 0.0, 0.0, false);
        }
    }

    private final ReadingStore          readingStore;
    private final SensorHealthAnalyzer  analyzer;
    private final SensorAnalysisService analysisService;
    private final AtomicBoolean         running = new AtomicBoolean(false);

    @Value("${analysis.drift-watch.enabled:false}")
    private boolean enabled;

    @Value("${analysis.drift-watch.sensors:}")
    private String sensorsConfig;

    @Value("${analysis.drift-watch.interval-ms:300000}")
    private long intervalMs;

    @Value("${analysis.drift-watch.window-size:200}")
    private int windowSize;

    public DriftWatchJob(ReadingStore readingStore,
                         SensorHealthAnalyzer analyzer,
                         SensorAnalysisService analysisService) {
        this.readingStore    = readingStore;
        this.analyzer        = analyzer;
        this.analysisService = analysisService;
    }

    @PostConstruct
    public void start() {
        List<String> sensors = Arrays.stream(sensorsConfig.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        if (!enabled || sensors.isEmpty()) {
            log.info("Drift watch disabled. enabled={} sensors={}", enabled, sensors);
            return;
        }
        running.set(true);
        Duration interval = Duration.ofMillis(intervalMs);
        log.info("Drift watch started. sensors={} intervalSeconds={}", sensors, interval.toSeconds());
        sensors.forEach(sensorId -> scheduleNextCycle(sensorId, interval));
    }

    @PreDestroy
    public void stop() {
        running.set(false);
    }

    /**
     * One cycle per call; the terminal subscribe schedules the next one, so each
     * cycle is a fresh Mono and nothing accumulates.
     */
    private void scheduleNextCycle(String sensorId, Duration delay) {
        if (!running.get()) return;
        Mono.delay(delay)
            .then(Mono.defer(() -> {
                String traceId = UUID.randomUUID().toString();
                return TraceContextUtil.withTraceId(checkSensor(sensorId), traceId);
            }))
            .subscribe(
                check -> scheduleNextCycle(sensorId, delay),
                err -> {
                    log.error("Drift watch cycle failed. sensorId={}", sensorId, err);
                    scheduleNextCycle(sensorId, delay);
                }
            );
    }

    /**
     * Runs the lightweight pass for one sensor and escalates when needed.
     */
    public Mono<DriftCheck> checkSensor(String sensorId) {
        return readingStore.fetchSeries(sensorId, ReadingQuery.latest(windowSize))
            .flatMap(values -> Mono.fromCallable(() -> lightweightPass(sensorId, values))
                .subscribeOn(Schedulers.boundedElastic()))
            .flatMap(check -> {
                if (!check.escalate()) return Mono.just(check);
                log.warn("Drift threshold crossed, escalating. sensorId={} slope={} noiseStd={}",
                         sensorId, check.slope(), check.noiseStd());
                return analysisService.analyzeStored(sensorId, ReadingQuery.latest(windowSize), null)
                    .doOnNext(report -> logEscalation(report))
                    .thenReturn(check);
            });
    }

    DriftCheck lightweightPass(String sensorId, List<Double> values) {
        AnalysisConfig config = analyzer.config();
        CleanSeries series = analyzer.preprocess(values);
        if (series.size() < config.effectiveMinimum()) {
            log.debug("Drift watch skipped, too few readings. sensorId={} count={}", sensorId, series.size());
            return DriftCheck.skipped(sensorId, series.size());
        }
        double slope = analyzer.slope(series);
        double noise = analyzer.noise(series).noiseStd();
        boolean escalate = Math.abs(slope) > config.slopeWarning() || noise > config.noiseCritical();
        log.info("Drift watch pass. sensorId={} readings={} slope={} noiseStd={} escalate={}",
                 sensorId, series.size(), slope, noise, escalate);
        return new DriftCheck(sensorId, series.size(), slope, noise, escalate);
    }

    private static void logEscalation(AnalysisReport report) {
        log.info("Drift escalation analysed. sensorId={} score={} status={} flags={}",
                 report.sensorId(), report.healthScore(), report.status().label(), report.flags());
    }
}
