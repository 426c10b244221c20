package com.sensorplatform.analysis.job;

import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.analysis.service.SensorAnalysisService;
import com.sensorplatform.analysis.store.ReadingStore;
import com.sensorplatform.common.engine.SensorHealthAnalyzer;
import com.sensorplatform.common.synthetic.SignalType;
import com.sensorplatform.common.synthetic.SyntheticSignalGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DriftWatchJobTest {

    private ReadingStore readingStore;
    private SensorAnalysisService analysisService;
    private DriftWatchJob job;

    @BeforeEach
    void setUp() {
        readingStore    = mock(ReadingStore.class);
        analysisService = mock(SensorAnalysisService.class);
        job = new DriftWatchJob(readingStore, new SensorHealthAnalyzer(), analysisService);
        ReflectionTestUtils.setField(job, "windowSize", 200);
    }

    @Test
    void quietSensorIsNotEscalated() {
        List<Double> normal = SyntheticSignalGenerator.generate(SignalType.NORMAL, 100, 42);
        when(readingStore.fetchSeries(eq("pump-1"), any())).thenReturn(Mono.just(normal));

        StepVerifier.create(job.checkSensor("pump-1"))
            .assertNext(check -> {
                assertFalse(check.escalate());
                assertEquals(100, check.readings());
                assertTrue(check.noiseStd() < 1.5);
            })
            .verifyComplete();
        verify(analysisService, never()).analyzeStored(any(), any(), any());
    }

    @Test
    void noisySensorEscalatesToFullAnalysis() {
        List<Double> noisy = SyntheticSignalGenerator.generate(SignalType.NOISY, 100, 42);
        when(readingStore.fetchSeries(eq("pump-1"), any())).thenReturn(Mono.just(noisy));
        AnalysisReport report = AnalysisReport.of("pump-1", Instant.EPOCH, new SensorHealthAnalyzer().analyze(noisy));
        when(analysisService.analyzeStored(eq("pump-1"), any(), any())).thenReturn(Mono.just(report));

        StepVerifier.create(job.checkSensor("pump-1"))
            .assertNext(check -> {
                assertTrue(check.escalate());
                assertTrue(check.noiseStd() > 1.5);
            })
            .verifyComplete();
        verify(analysisService).analyzeStored(eq("pump-1"), any(), any());
    }

    @Test
    void steepSlopeEscalates() {
        List<Double> ramp = new ArrayList<>();
        for (int i = 0; i < 60; i++) ramp.add(0.2 * i);

        DriftWatchJob.DriftCheck check = job.lightweightPass("pump-1", ramp);
        assertTrue(check.escalate());
        assertEquals(0.2, check.slope(), 1e-9);
    }

    @Test
    void shortWindowIsSkipped() {
        DriftWatchJob.DriftCheck check = job.lightweightPass("pump-1", List.of(1.0, 2.0, 3.0));
        assertFalse(check.escalate());
        assertEquals(3, check.readings());
        assertEquals(0.0, check.slope());
    }
}
