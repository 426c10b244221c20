package com.sensorplatform.analysis.store.r2dbc;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AnalysisResultRepository extends ReactiveCrudRepository<AnalysisResultEntity, Long> {

    @Query("""
        SELECT * FROM analysis_results
        WHERE sensor_id = :sensorId
        ORDER BY analyzed_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<AnalysisResultEntity> findRecent(String sensorId, int limit);
}
