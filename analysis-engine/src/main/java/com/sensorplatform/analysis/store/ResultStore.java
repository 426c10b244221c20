package com.sensorplatform.analysis.store;

import com.sensorplatform.analysis.model.AnalysisReport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence for computed analysis reports.
 */
public interface ResultStore {

    Mono<AnalysisReport> save(AnalysisReport report);

    /** The newest {@code limit} reports for the sensor, newest first. */
    Flux<AnalysisReport> history(String sensorId, int limit);
}
