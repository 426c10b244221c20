package com.sensorplatform.analysis.controller;

import com.sensorplatform.analysis.batch.BatchAnalysisService;
import com.sensorplatform.analysis.batch.BatchJobState;
import com.sensorplatform.analysis.dto.AnalyzeRequest;
import com.sensorplatform.analysis.dto.BatchRequest;
import com.sensorplatform.analysis.dto.DfaResponse;
import com.sensorplatform.analysis.dto.ReadingAccepted;
import com.sensorplatform.analysis.dto.ReadingRequest;
import com.sensorplatform.analysis.dto.SeriesRequest;
import com.sensorplatform.analysis.dto.SyntheticRequest;
import com.sensorplatform.analysis.dto.SyntheticResponse;
import com.sensorplatform.analysis.logger.AnalysisFlowLogger;
import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.analysis.service.AnalysisTaskDispatcher;
import com.sensorplatform.analysis.service.SensorAnalysisService;
import com.sensorplatform.common.exception.SensorAnalysisException;
import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.model.SeriesStatistics;
import com.sensorplatform.common.synthetic.SignalType;
import com.sensorplatform.common.synthetic.SyntheticSignalGenerator;
import com.sensorplatform.common.trace.TraceContextUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    static final int MAX_HISTORY = 100;
    static final int MIN_SYNTHETIC_LENGTH = 10;
    static final int MAX_SYNTHETIC_LENGTH = 10_000;

    private final SensorAnalysisService  analysisService;
    private final AnalysisTaskDispatcher dispatcher;
    private final BatchAnalysisService   batchService;
    private final AnalysisFlowLogger     flowLogger;
    private final AnalysisConfig         serverDefaults;

    public AnalysisController(SensorAnalysisService analysisService,
                              AnalysisTaskDispatcher dispatcher,
                              BatchAnalysisService batchService,
                              AnalysisFlowLogger flowLogger,
                              AnalysisConfig serverDefaults) {
        this.analysisService = analysisService;
        this.dispatcher      = dispatcher;
        this.batchService    = batchService;
        this.flowLogger      = flowLogger;
        this.serverDefaults  = serverDefaults;
    }

    @PostMapping
    public Mono<ResponseEntity<AnalysisReport>> analyze(
            @RequestBody AnalyzeRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        Mono<AnalysisReport> pipeline = Mono.defer(() -> {
            String sensorId = requireSensorId(request.sensorId());
            AnalysisConfig config = toConfig(serverDefaults, request.config());
            flowLogger.logWithTraceId(AnalysisFlowLogger.REQUEST_RECEIVED, sensorId, traceId);
            if (request.hasValues()) {
                return analysisService.analyzeValues(sensorId, request.values(), config);
            }
            return analysisService.analyzeStored(sensorId,
                analysisService.resolveQuery(request.from(), request.to(), request.windowSize()), config);
        });
        return TraceContextUtil.withTraceId(pipeline, traceId)
            .doOnNext(report -> flowLogger.logReport(report, traceId))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{sensorId}/history")
    public Mono<ResponseEntity<List<AnalysisReport>>> history(
            @PathVariable String sensorId,
            @RequestParam(defaultValue = "20") int limit) {
        int capped = Math.max(1, Math.min(limit, MAX_HISTORY));
        return analysisService.history(sensorId, capped)
            .collectList()
            .map(ResponseEntity::ok);
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchJobState>> startBatch(@RequestBody BatchRequest request) {
        return Mono.defer(() -> batchService.start(request.sensorIds(), request.windowSize(), toConfig(serverDefaults, request.config())))
            .map(state -> ResponseEntity.status(HttpStatus.ACCEPTED).body(state));
    }

    @GetMapping("/batch/{jobId}")
    public Mono<ResponseEntity<BatchJobState>> batchStatus(@PathVariable String jobId) {
        return batchService.status(jobId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/batch/{jobId}/cancel")
    public Mono<ResponseEntity<BatchJobState>> cancelBatch(@PathVariable String jobId) {
        return batchService.cancel(jobId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PostMapping("/statistics")
    public Mono<ResponseEntity<SeriesStatistics>> statistics(@RequestBody SeriesRequest request) {
        return dispatcher.calculateStatistics(requireValues(request.values()))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/dfa")
    public Mono<ResponseEntity<DfaResponse>> dfa(@RequestBody SeriesRequest request) {
        return dispatcher.calculateDfa(requireValues(request.values()))
            .map(DfaResponse::from)
            .map(ResponseEntity::ok);
    }

    @PostMapping("/synthetic")
    public Mono<ResponseEntity<SyntheticResponse>> synthetic(@RequestBody SyntheticRequest request) {
        return Mono.fromCallable(() -> generate(request)).map(ResponseEntity::ok);
    }

    @PostMapping("/readings")
    public Mono<ResponseEntity<ReadingAccepted>> ingest(@RequestBody ReadingRequest request) {
        return Mono.defer(() -> {
                String sensorId = requireSensorId(request.sensorId());
                if (request.value() == null) {
                    throw SensorAnalysisException.invalidInput("Reading value is required");
                }
                return analysisService.ingestReading(sensorId, request.value(), request.timestamp())
                    .map(recordedAt -> ReadingAccepted.received(sensorId, recordedAt));
            })
            .map(body -> ResponseEntity.status(HttpStatus.ACCEPTED).body(body));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── request helpers ────────────────────────────────────────────────────

    /**
     * Absent or empty config means the server defaults; a partial config overrides
     * only the fields it names and keeps the server defaults for the rest.
     */
    static AnalysisConfig toConfig(AnalysisConfig serverDefaults, Map<String, Object> raw) {
        return raw == null || raw.isEmpty() ? null : AnalysisConfig.fromMap(serverDefaults, raw);
    }

    private static String requireSensorId(String sensorId) {
        if (sensorId == null || sensorId.isBlank()) {
            throw SensorAnalysisException.invalidInput("sensor_id is required");
        }
        return sensorId;
    }

    private static List<Double> requireValues(List<Double> values) {
        if (values == null) {
            throw SensorAnalysisException.invalidInput("values is required");
        }
        return values;
    }

    static SyntheticResponse generate(SyntheticRequest request) {
        if (request.type() == null) {
            throw SensorAnalysisException.invalidInput("type is required");
        }
        SignalType type = SignalType.fromName(request.type());
        int length = request.length() != null ? request.length() : 100;
        if (length < MIN_SYNTHETIC_LENGTH || length > MAX_SYNTHETIC_LENGTH) {
            throw SensorAnalysisException.invalidInput(
                "length must be between " + MIN_SYNTHETIC_LENGTH + " and " + MAX_SYNTHETIC_LENGTH + ", got " + length);
        }
        long seed = request.seed() != null ? request.seed() : ThreadLocalRandom.current().nextLong();
        List<Double> data = SyntheticSignalGenerator.generate(type, length, seed);
        List<Double> timestamps = Arrays.stream(SyntheticSignalGenerator.timeAxis(length)).boxed().toList();
        return new SyntheticResponse(data, timestamps, request.type(), length, seed);
    }
}
