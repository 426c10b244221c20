package com.sensorplatform.analysis.service;

import com.sensorplatform.analysis.logger.AnalysisFlowLogger;
import com.sensorplatform.analysis.model.AnalysisOutcome;
import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.analysis.store.ReadingQuery;
import com.sensorplatform.analysis.store.ReadingStore;
import com.sensorplatform.analysis.store.ResultStore;
import com.sensorplatform.common.engine.SensorHealthAnalyzer;
import com.sensorplatform.common.exception.SensorAnalysisException;
import com.sensorplatform.common.exception.SensorAnalysisException.ErrorKind;
import com.sensorplatform.common.model.AnalysisOutput;
import com.sensorplatform.common.synthetic.SignalType;
import com.sensorplatform.common.synthetic.SyntheticSignalGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SensorAnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    private static final List<Double> NORMAL =
        SyntheticSignalGenerator.generate(SignalType.NORMAL, 100, 42);

    private AnalysisTaskDispatcher dispatcher;
    private ReadingStore readingStore;
    private ResultStore resultStore;
    private SensorAnalysisService service;

    @BeforeEach
    void setUp() {
        dispatcher   = mock(AnalysisTaskDispatcher.class);
        readingStore = mock(ReadingStore.class);
        resultStore  = mock(ResultStore.class);
        service = new SensorAnalysisService(dispatcher, readingStore, resultStore,
            new AnalysisFlowLogger(), Clock.fixed(NOW, ZoneOffset.UTC), 1000, 10000);
    }

    private static AnalysisReport report(AnalysisOutput output) {
        return AnalysisReport.of("pump-1", NOW, output);
    }

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("successful reports are saved and returned")
        void savesReport() {
            AnalysisReport report = report(new SensorHealthAnalyzer().analyze(NORMAL));
            when(dispatcher.submit("pump-1", NORMAL, null))
                .thenReturn(Mono.just(AnalysisOutcome.success(report, 1)));
            when(resultStore.save(report)).thenReturn(Mono.just(report));

            StepVerifier.create(service.analyzeValues("pump-1", NORMAL, null))
                .expectNext(report)
                .verifyComplete();
            verify(resultStore).save(report);
        }

        @Test
        @DisplayName("a store failure does not fail the analysis")
        void storeFailureSwallowed() {
            AnalysisReport report = report(new SensorHealthAnalyzer().analyze(NORMAL));
            when(dispatcher.submit("pump-1", NORMAL, null))
                .thenReturn(Mono.just(AnalysisOutcome.success(report, 1)));
            when(resultStore.save(report)).thenReturn(Mono.error(new IllegalStateException("disk full")));

            StepVerifier.create(service.analyzeValues("pump-1", NORMAL, null))
                .expectNext(report)
                .verifyComplete();
        }

        @Test
        @DisplayName("No Data reports are returned but not saved")
        void noDataNotSaved() {
            AnalysisReport report = report(AnalysisOutput.noData());
            when(dispatcher.submit(eq("pump-1"), any(), any()))
                .thenReturn(Mono.just(AnalysisOutcome.success(report, 1)));

            StepVerifier.create(service.analyzeValues("pump-1", List.of(1.0, 2.0), null))
                .assertNext(r -> assertFalse(r.hasData()))
                .verifyComplete();
            verify(resultStore, never()).save(any());
        }

        @Test
        @DisplayName("failed outcomes surface as the matching exception")
        void failureBecomesError() {
            when(dispatcher.submitStored(eq("pump-1"), any(), any()))
                .thenReturn(Mono.just(AnalysisOutcome.failure("pump-1", ErrorKind.INVALID_INPUT, "bad", 1)));

            StepVerifier.create(service.analyzeStored("pump-1", ReadingQuery.latest(10), null))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(SensorAnalysisException.class, e);
                    assertEquals(ErrorKind.INVALID_INPUT, ((SensorAnalysisException) e).getKind());
                })
                .verify();
            verify(resultStore, never()).save(any());
        }
    }

    @Nested
    @DisplayName("Query resolution")
    class QueryResolution {

        @Test
        void defaultWindow() {
            ReadingQuery q = service.resolveQuery(null, null, null);
            assertFalse(q.hasRange());
            assertEquals(1000, q.maxCount());
        }

        @Test
        void windowCappedAtMaximum() {
            assertEquals(10000, service.resolveQuery(null, null, 50_000).maxCount());
            assertEquals(250, service.resolveQuery(null, null, 250).maxCount());
            assertEquals(1000, service.resolveQuery(null, null, 0).maxCount());
        }

        @Test
        void rangeUsesMaximum() {
            ReadingQuery q = service.resolveQuery(NOW.minusSeconds(3600), NOW, 20);
            assertTrue(q.hasRange());
            assertEquals(10000, q.maxCount());
        }
    }

    @Nested
    @DisplayName("Reading ingest")
    class Ingest {

        @Test
        @DisplayName("stores the reading stamped with the current time when none is given")
        void stampsMissingTimestamp() {
            when(readingStore.append("pump-1", 4.2, NOW)).thenReturn(Mono.empty());
            when(readingStore.fetchSeries(eq("pump-1"), any())).thenReturn(Mono.just(List.of(4.2)));

            StepVerifier.create(service.ingestReading("pump-1", 4.2, null))
                .expectNext(NOW)
                .verifyComplete();
            verify(readingStore).append("pump-1", 4.2, NOW);
        }

        @Test
        @DisplayName("background pass skips sensors with too few readings")
        void backgroundSkipsShortHistory() {
            when(readingStore.fetchSeries(eq("pump-1"), any())).thenReturn(Mono.just(List.of(1.0, 2.0, 3.0)));

            StepVerifier.create(service.backgroundAnalysis("pump-1"))
                .verifyComplete();
            verify(dispatcher, never()).submit(anyString(), any(), any());
        }

        @Test
        @DisplayName("background pass analyses and saves once enough readings exist")
        void backgroundAnalysesAndSaves() {
            AnalysisReport report = report(new SensorHealthAnalyzer().analyze(NORMAL));
            when(readingStore.fetchSeries(eq("pump-1"), any())).thenReturn(Mono.just(NORMAL));
            when(dispatcher.submit("pump-1", NORMAL, null))
                .thenReturn(Mono.just(AnalysisOutcome.success(report, 1)));
            when(resultStore.save(report)).thenReturn(Mono.just(report));

            StepVerifier.create(service.backgroundAnalysis("pump-1"))
                .expectNext(report)
                .verifyComplete();
            verify(resultStore).save(report);
        }
    }
}
