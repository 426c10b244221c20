package com.sensorplatform.analysis.store.r2dbc;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface SensorReadingRepository extends ReactiveCrudRepository<SensorReadingEntity, Long> {

    /**
     * Newest {@code limit} readings of the sensor, returned oldest first.
     */
    @Query("""
        SELECT * FROM (
            SELECT * FROM sensor_readings
            WHERE sensor_id = :sensorId
            ORDER BY recorded_at DESC, id DESC
            LIMIT :limit
        ) latest
        ORDER BY recorded_at ASC, id ASC
        """)
    Flux<SensorReadingEntity> findLatest(String sensorId, int limit);

    /**
     * Readings inside {@code [from, to]}, oldest first, at most {@code limit}.
     */
    @Query("""
        SELECT * FROM sensor_readings
        WHERE sensor_id = :sensorId
          AND recorded_at >= :from
          AND recorded_at <= :to
        ORDER BY recorded_at ASC, id ASC
        LIMIT :limit
        """)
    Flux<SensorReadingEntity> findInRange(String sensorId, LocalDateTime from, LocalDateTime to, int limit);
}
