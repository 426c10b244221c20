package com.sensorplatform.analysis.store.r2dbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.common.engine.SensorHealthAnalyzer;
import com.sensorplatform.common.model.HealthStatus;
import com.sensorplatform.common.synthetic.SignalType;
import com.sensorplatform.common.synthetic.SyntheticSignalGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class R2dbcResultStoreTest {

    private static final Instant AT = Instant.parse("2024-03-01T12:00:00Z");

    private AnalysisResultRepository repository;
    private R2dbcResultStore store;
    private AnalysisReport report;

    @BeforeEach
    void setUp() {
        repository = mock(AnalysisResultRepository.class);
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        store = new R2dbcResultStore(repository, mapper);
        report = AnalysisReport.of("pump-1", AT, new SensorHealthAnalyzer()
            .analyze(SyntheticSignalGenerator.generate(SignalType.DRIFTING, 100, 42)));
    }

    @Test
    void entityColumnsFollowTheReport() {
        AnalysisResultEntity entity = store.toEntity(report);

        assertEquals("pump-1", entity.getSensorId());
        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0), entity.getAnalyzedAt());
        assertEquals("Warning", entity.getStatus());
        assertEquals(report.healthScore(), entity.getHealthScore());
        assertTrue(entity.getFlags().startsWith("["));
        assertTrue(entity.getMetrics().contains("\"noise_std\""));
    }

    @Test
    void storedRowReadsBackAsTheSameReport() {
        AnalysisReport restored = store.toReport(store.toEntity(report));

        assertEquals(report, restored);
        assertEquals(HealthStatus.WARNING, restored.status());
    }

    @Test
    void rowWithoutMetricsReadsAsEmptyBundle() {
        AnalysisResultEntity entity = store.toEntity(report);
        entity.setMetrics(null);
        entity.setFlags(null);

        AnalysisReport restored = store.toReport(entity);
        assertTrue(restored.flags().isEmpty());
        assertEquals(0.5, restored.metrics().hurst());
    }

    @Test
    void corruptMetricsFailLoudly() {
        AnalysisResultEntity entity = store.toEntity(report);
        entity.setMetrics("{not json");

        assertThrows(IllegalStateException.class, () -> store.toReport(entity));
    }

    @Test
    void saveReturnsTheReport() {
        when(repository.save(any(AnalysisResultEntity.class)))
            .thenAnswer(inv -> {
                AnalysisResultEntity e = inv.getArgument(0);
                e.setId(7L);
                return Mono.just(e);
            });

        StepVerifier.create(store.save(report)).expectNext(report).verifyComplete();
        verify(repository).save(any(AnalysisResultEntity.class));
    }

    @Test
    void historyMapsRows() {
        when(repository.findRecent("pump-1", 5)).thenReturn(Flux.just(store.toEntity(report)));

        StepVerifier.create(store.history("pump-1", 5)).expectNext(report).verifyComplete();
    }
}
