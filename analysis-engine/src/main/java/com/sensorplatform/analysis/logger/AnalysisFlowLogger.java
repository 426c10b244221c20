package com.sensorplatform.analysis.logger;

import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage an analysis request passes through. Pure side effects; never
 * alters the pipeline it observes.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}   : HTTP call, batch step or periodic pass asked for an analysis</li>
 *   <li>{@link #SERIES_LOADED}      : readings are in hand (from the request or the reading store)</li>
 *   <li>{@link #ANALYSIS_COMPLETED} : the engine produced a report</li>
 *   <li>{@link #RESULT_PERSISTED}   : the report was written to the result store</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (trace id read from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(AnalysisFlowLogger.SERIES_LOADED))
 * </pre>
 */
@Component
public class AnalysisFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisFlowLogger.class);

    public static final String REQUEST_RECEIVED   = "REQUEST_RECEIVED";
    public static final String SERIES_LOADED      = "SERIES_LOADED";
    public static final String ANALYSIS_COMPLETED = "ANALYSIS_COMPLETED";
    public static final String RESULT_PERSISTED   = "RESULT_PERSISTED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on every
     * {@code onNext}. Errors and completion are ignored.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[AnalysisFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** For call sites where the trace id is already at hand. */
    public void logWithTraceId(String stageName, String sensorId, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[AnalysisFlow] stage={} sensorId={} traceId={}", stageName, sensorId, traceId)
        );
    }

    /**
     * Compact one-line summary of a finished report: score, status and flags.
     */
    public void logReport(AnalysisReport report, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[AnalysisFlow] stage={} sensorId={} score={} status={} flags={} traceId={}",
                     ANALYSIS_COMPLETED, report.sensorId(), report.healthScore(),
                     report.status().label(), report.flags(), traceId)
        );
    }
}
