package com.sensorplatform.analysis.store.r2dbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.analysis.store.ResultStore;
import com.sensorplatform.common.model.DescriptorBundle;
import com.sensorplatform.common.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * {@link ResultStore} over the {@code analysis_results} table. Flags and the
 * descriptor bundle are stored as JSON text columns.
 */
@Component
public class R2dbcResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcResultStore.class);

    private static final TypeReference<List<String>> FLAG_LIST = new TypeReference<>() {};

    private final AnalysisResultRepository repository;
    private final ObjectMapper objectMapper;

    public R2dbcResultStore(AnalysisResultRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<AnalysisReport> save(AnalysisReport report) {
        return Mono.fromCallable(() -> toEntity(report))
            .flatMap(repository::save)
            .doOnSuccess(saved -> log.info("Analysis result persisted. id={} sensorId={} status={}",
                                           saved.getId(), saved.getSensorId(), saved.getStatus()))
            .thenReturn(report);
    }

    @Override
    public Flux<AnalysisReport> history(String sensorId, int limit) {
        return repository.findRecent(sensorId, limit)
            .map(this::toReport);
    }

    AnalysisResultEntity toEntity(AnalysisReport report) {
        try {
            AnalysisResultEntity entity = new AnalysisResultEntity();
            entity.setSensorId(report.sensorId());
            entity.setAnalyzedAt(LocalDateTime.ofInstant(report.timestamp(), ZoneOffset.UTC));
            entity.setHealthScore(report.healthScore());
            entity.setStatus(report.status().label());
            entity.setDiagnosis(report.diagnosis());
            entity.setFlags(objectMapper.writeValueAsString(report.flags()));
            entity.setRecommendation(report.recommendation());
            entity.setPrediction(report.prediction());
            entity.setMetrics(objectMapper.writeValueAsString(report.metrics()));
            return entity;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analysis report for persistence", e);
        }
    }

    AnalysisReport toReport(AnalysisResultEntity entity) {
        try {
            return new AnalysisReport(
                entity.getSensorId(),
                entity.getAnalyzedAt().toInstant(ZoneOffset.UTC),
                entity.getHealthScore(),
                HealthStatus.fromLabel(entity.getStatus()),
                entity.getDiagnosis(),
                entity.getFlags() != null ? objectMapper.readValue(entity.getFlags(), FLAG_LIST) : List.of(),
                entity.getRecommendation(),
                entity.getPrediction(),
                entity.getMetrics() != null
                    ? objectMapper.readValue(entity.getMetrics(), DescriptorBundle.class)
                    : DescriptorBundle.empty());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read stored analysis result id=" + entity.getId(), e);
        }
    }
}
