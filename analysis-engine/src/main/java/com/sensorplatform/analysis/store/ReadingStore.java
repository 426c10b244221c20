package com.sensorplatform.analysis.store;

import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Source of stored sensor readings.
 *
 * <p>Implementations return values in chronological order (oldest first). A
 * sensor with no readings yields an empty list, never an error.
 */
public interface ReadingStore {

    Mono<List<Double>> fetchSeries(String sensorId, ReadingQuery query);

    /**
     * Appends one reading.
     *
     * @param value     the measured value; {@code null} records a missing reading
     * @param timestamp when it was measured
     */
    Mono<Void> append(String sensorId, Double value, Instant timestamp);
}
