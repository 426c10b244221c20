package com.sensorplatform.analysis.store.r2dbc;

import com.sensorplatform.analysis.exception.TransientAnalysisException;
import com.sensorplatform.analysis.store.ReadingQuery;
import com.sensorplatform.analysis.store.ReadingStore;
import io.r2dbc.spi.R2dbcTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ReadingStore} over the {@code sensor_readings} table.
 *
 * <p>Connection-level failures surface as {@link TransientAnalysisException} so the
 * dispatcher can retry them; everything else propagates unchanged.
 */
@Component
public class R2dbcReadingStore implements ReadingStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcReadingStore.class);

    static final LocalDateTime EARLIEST = LocalDateTime.of(1970, 1, 1, 0, 0);
    static final LocalDateTime LATEST   = LocalDateTime.of(9999, 12, 31, 23, 59, 59);

    private final SensorReadingRepository repository;

    public R2dbcReadingStore(SensorReadingRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<List<Double>> fetchSeries(String sensorId, ReadingQuery query) {
        Flux<SensorReadingEntity> rows = query.hasRange()
            ? repository.findInRange(sensorId, toLocal(query.from(), EARLIEST), toLocal(query.to(), LATEST),
                                     query.maxCount())
            : repository.findLatest(sensorId, query.maxCount());

        // collect() rather than map(): missing readings are null and must survive
        return rows
            .<List<Double>>collect(ArrayList::new, (list, row) -> list.add(row.getReadingValue()))
            .doOnSuccess(values -> log.debug("Readings fetched. sensorId={} count={}", sensorId, values.size()))
            .onErrorMap(R2dbcReadingStore::isTransient,
                        e -> new TransientAnalysisException("Reading store unavailable for sensor " + sensorId, e));
    }

    @Override
    public Mono<Void> append(String sensorId, Double value, Instant timestamp) {
        SensorReadingEntity entity = new SensorReadingEntity();
        entity.setSensorId(sensorId);
        entity.setReadingValue(value);
        entity.setRecordedAt(LocalDateTime.ofInstant(timestamp, ZoneOffset.UTC));
        return repository.save(entity)
            .doOnSuccess(saved -> log.debug("Reading stored. id={} sensorId={}", saved.getId(), sensorId))
            .onErrorMap(R2dbcReadingStore::isTransient,
                        e -> new TransientAnalysisException("Reading store unavailable for sensor " + sensorId, e))
            .then();
    }

    static boolean isTransient(Throwable e) {
        return e instanceof R2dbcTransientException
            || e instanceof TransientDataAccessException
            || e instanceof DataAccessResourceFailureException;
    }

    private static LocalDateTime toLocal(Instant instant, LocalDateTime fallback) {
        return instant != null ? LocalDateTime.ofInstant(instant, ZoneOffset.UTC) : fallback;
    }
}
