package com.sensorplatform.analysis.batch;

import com.sensorplatform.analysis.model.AnalysisOutcome;
import com.sensorplatform.analysis.service.AnalysisTaskDispatcher;
import com.sensorplatform.analysis.service.SensorAnalysisService;
import com.sensorplatform.analysis.store.ReadingQuery;
import com.sensorplatform.common.exception.SensorAnalysisException;
import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Analyses many sensors in one background job.
 *
 * <p>Each job runs its sensors one after another on a bounded-elastic thread,
 * reading each sensor's latest window from the store, persisting successful
 * reports and recording every outcome in its {@link BatchJobState}. A failure on
 * one sensor is recorded and the job moves on. Jobs are independent of each
 * other; cancelling one stops it before its next sensor.
 */
@Service
public class BatchAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(BatchAnalysisService.class);

    private final AnalysisTaskDispatcher dispatcher;
    private final SensorAnalysisService  analysisService;
    private final Clock                  clock;
    private final int                    retainedJobs;

    private final Map<String, BatchJobState> jobs = new ConcurrentHashMap<>();

    @Autowired
    public BatchAnalysisService(AnalysisTaskDispatcher dispatcher,
                                SensorAnalysisService analysisService,
                                Clock clock,
                                @Value("${analysis.batch.retained-jobs:100}") int retainedJobs) {
        this.dispatcher      = dispatcher;
        this.analysisService = analysisService;
        this.clock           = clock;
        this.retainedJobs    = retainedJobs;
    }

    /**
     * Starts a job and returns its initial state immediately.
     *
     * @param windowSize readings per sensor; {@code null} takes the service default
     * @param config     thresholds shared by every sensor of the job; {@code null} for defaults
     */
    public Mono<BatchJobState> start(List<String> sensorIds, Integer windowSize, AnalysisConfig config) {
        if (sensorIds == null || sensorIds.isEmpty()) {
            return Mono.error(SensorAnalysisException.invalidInput("Batch needs at least one sensor id"));
        }
        pruneFinishedJobs();

        String jobId = UUID.randomUUID().toString();
        BatchJobState state = new BatchJobState(jobId, sensorIds.size(), clock.instant());
        jobs.put(jobId, state);
        ReadingQuery query = analysisService.resolveQuery(null, null, windowSize);
        List<String> ids = List.copyOf(sensorIds);

        log.info("[Batch] Job started. jobId={} sensors={}", jobId, ids.size());
        Mono.fromRunnable(() -> runLoop(state, ids, query, config))
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                v -> {},
                e -> {
                    log.error("[Batch] Job failed unexpectedly. jobId={}", jobId, e);
                    state.error(e.getMessage(), clock.instant());
                }
            );
        return Mono.just(state);
    }

    public Mono<BatchJobState> status(String jobId) {
        return Mono.justOrEmpty(jobs.get(jobId));
    }

    /** Requests cancellation; empty if the job is unknown. */
    public Mono<BatchJobState> cancel(String jobId) {
        return Mono.justOrEmpty(jobs.get(jobId))
            .doOnNext(state -> {
                boolean accepted = state.requestCancel();
                log.info("[Batch] Cancel requested. jobId={} accepted={}", jobId, accepted);
            });
    }

    /**
     * Worker loop. Blocking on each sensor's Mono is intentional: the loop owns a
     * bounded-elastic thread and must observe the cancel flag between sensors.
     */
    private void runLoop(BatchJobState state, List<String> sensorIds, ReadingQuery query, AnalysisConfig config) {
        String traceId = state.getJobId();
        for (int i = 0; i < sensorIds.size(); i++) {
            if (state.isCancelRequested()) {
                log.info("[Batch] Cancelled before sensor {}/{}. jobId={}", i + 1, sensorIds.size(), traceId);
                state.cancelled(clock.instant());
                return;
            }
            String sensorId = sensorIds.get(i);
            state.advance(sensorId);

            AnalysisOutcome outcome = TraceContextUtil.withTraceId(
                    dispatcher.submitStored(sensorId, query, config)
                        .flatMap(o -> o.success()
                            ? analysisService.persistQuietly(o.report()).thenReturn(o)
                            : Mono.just(o)),
                    traceId)
                .block();
            state.record(sensorId, outcome);
            log.info("[Batch] Sensor done. jobId={} sensorId={} progress={}/{} success={}",
                     traceId, sensorId, i + 1, sensorIds.size(), outcome != null && outcome.success());
        }
        state.complete(clock.instant());
        log.info("[Batch] Job complete. jobId={} sensors={}", traceId, sensorIds.size());
    }

    private void pruneFinishedJobs() {
        if (jobs.size() < retainedJobs) return;
        jobs.values().stream()
            .filter(BatchJobState::isFinished)
            .sorted(Comparator.comparing(BatchJobState::getFinishedAt))
            .limit(Math.max(1, jobs.size() - retainedJobs + 1))
            .map(BatchJobState::getJobId)
            .toList()
            .forEach(jobs::remove);
    }
}
