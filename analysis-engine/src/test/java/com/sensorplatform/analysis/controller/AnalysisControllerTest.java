package com.sensorplatform.analysis.controller;

import com.sensorplatform.analysis.batch.BatchAnalysisService;
import com.sensorplatform.analysis.batch.BatchJobState;
import com.sensorplatform.analysis.logger.AnalysisFlowLogger;
import com.sensorplatform.analysis.model.AnalysisReport;
import com.sensorplatform.analysis.service.AnalysisTaskDispatcher;
import com.sensorplatform.analysis.service.SensorAnalysisService;
import com.sensorplatform.analysis.store.ReadingQuery;
import com.sensorplatform.common.engine.SensorHealthAnalyzer;
import com.sensorplatform.common.exception.SensorAnalysisException;
import com.sensorplatform.common.model.AnalysisConfig;
import com.sensorplatform.common.synthetic.SignalType;
import com.sensorplatform.common.synthetic.SyntheticSignalGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(AnalysisController.class)
@Import({AnalysisFlowLogger.class, AnalysisControllerTest.ServerDefaults.class})
class AnalysisControllerTest {

    @TestConfiguration
    static class ServerDefaults {
        @Bean
        AnalysisConfig defaultAnalysisConfig() {
            return AnalysisConfig.builder().minDataPoints(20).build();
        }
    }

    private static final Instant AT = Instant.parse("2024-03-01T12:00:00Z");

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private SensorAnalysisService analysisService;

    @MockBean
    private AnalysisTaskDispatcher dispatcher;

    @MockBean
    private BatchAnalysisService batchService;

    private static AnalysisReport normalReport() {
        List<Double> values = SyntheticSignalGenerator.generate(SignalType.NORMAL, 100, 42);
        return AnalysisReport.of("pump-1", AT, new SensorHealthAnalyzer().analyze(values));
    }

    @Test
    void shouldAnalyzeInlineValues() {
        when(analysisService.analyzeValues(eq("pump-1"), anyList(), isNull()))
                .thenReturn(Mono.just(normalReport()));

        webTestClient.post()
                .uri("/api/v1/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Trace-Id", "trace-123")
                .bodyValue("""
                    {"sensor_id": "pump-1", "values": [1.0, 2.0, null, 3.0]}
                    """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sensor_id").isEqualTo("pump-1")
                .jsonPath("$.status").isEqualTo("Normal")
                .jsonPath("$.health_score").isEqualTo(90.0)
                .jsonPath("$.metrics.noise_std").exists();
    }

    @Test
    void shouldAnalyzeStoredReadingsWhenNoValuesGiven() {
        ReadingQuery query = ReadingQuery.latest(500);
        when(analysisService.resolveQuery(null, null, 500)).thenReturn(query);
        when(analysisService.analyzeStored(eq("pump-1"), eq(query), any()))
                .thenReturn(Mono.just(normalReport()));

        webTestClient.post()
                .uri("/api/v1/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"sensor_id": "pump-1", "window_size": 500, "config": {"noise_critical": 2.5}}
                    """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("Normal");

        verify(analysisService).analyzeStored(eq("pump-1"), eq(query), argThat(config ->
                config.noiseCritical() == 2.5
                        && config.minDataPoints() == 20
                        && config.slopeCritical() == AnalysisConfig.DEFAULT_SLOPE_CRITICAL));
    }

    @Test
    void shouldAnalyzeEmptyInlineValuesInsteadOfStoredReadings() {
        when(analysisService.analyzeValues(eq("pump-1"), eq(List.of()), isNull()))
                .thenReturn(Mono.just(AnalysisReport.of("pump-1", AT,
                        new SensorHealthAnalyzer().analyze(List.of()))));

        webTestClient.post()
                .uri("/api/v1/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"sensor_id": "pump-1", "values": []}
                    """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("No Data");

        verify(analysisService).analyzeValues(eq("pump-1"), eq(List.of()), isNull());
        verify(analysisService, never()).analyzeStored(any(), any(), any());
    }

    @Test
    void shouldRejectUnknownConfigField() {
        webTestClient.post()
                .uri("/api/v1/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"sensor_id": "pump-1", "values": [1.0], "config": {"noise_limit": 2.5}}
                    """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.error_kind").isEqualTo("INVALID_INPUT")
                .jsonPath("$.message").value(containsString("noise_limit"))
                .jsonPath("$.message").value(not(startsWith("[INVALID_INPUT]")));

        verify(analysisService, never()).analyzeValues(any(), any(), any());
    }

    @Test
    void shouldRejectInvalidThreshold() {
        webTestClient.post()
                .uri("/api/v1/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"sensor_id": "pump-1", "values": [1.0], "config": {"slope_warning": 0.5}}
                    """)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void shouldRejectMissingSensorId() {
        webTestClient.post()
                .uri("/api/v1/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"values": [1.0, 2.0]}
                    """)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void shouldRejectNonNumericReadings() {
        webTestClient.post()
                .uri("/api/v1/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"sensor_id": "pump-1", "values": [1.0, "abc"]}
                    """)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void shouldMapComputationFailureToServerError() {
        when(analysisService.analyzeValues(eq("pump-1"), anyList(), isNull()))
                .thenReturn(Mono.error(SensorAnalysisException.computationFailure("boom", null)));

        webTestClient.post()
                .uri("/api/v1/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"sensor_id": "pump-1", "values": [1.0, 2.0]}
                    """)
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Computation Failure")
                .jsonPath("$.error_kind").isEqualTo("COMPUTATION_FAILURE")
                .jsonPath("$.message").isEqualTo("boom");
    }

    @Test
    void shouldReturnHistory() {
        when(analysisService.history("pump-1", 100)).thenReturn(Flux.just(normalReport()));

        webTestClient.get()
                .uri("/api/v1/analyze/pump-1/history?limit=500")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].sensor_id").isEqualTo("pump-1");
    }

    @Test
    void shouldStartBatch() {
        BatchJobState state = new BatchJobState("job-1", 2, AT);
        when(batchService.start(eq(List.of("a", "b")), isNull(), isNull())).thenReturn(Mono.just(state));

        webTestClient.post()
                .uri("/api/v1/analyze/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"sensor_ids": ["a", "b"]}
                    """)
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.job_id").isEqualTo("job-1")
                .jsonPath("$.status").isEqualTo("RUNNING")
                .jsonPath("$.total").isEqualTo(2);
    }

    @Test
    void shouldReturnNotFoundForUnknownBatch() {
        when(batchService.status("missing")).thenReturn(Mono.empty());

        webTestClient.get()
                .uri("/api/v1/analyze/batch/missing")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void shouldComputeDfa() {
        List<Double> values = SyntheticSignalGenerator.generate(SignalType.NORMAL, 200, 7);
        when(dispatcher.calculateDfa(anyList()))
                .thenReturn(Mono.fromCallable(() -> new SensorHealthAnalyzer()
                        .dfa(new SensorHealthAnalyzer().preprocess(values))));

        webTestClient.post()
                .uri("/api/v1/analyze/dfa")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"values\": [1.0, 2.0]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.hurst").exists()
                .jsonPath("$.hurst_r2").exists()
                .jsonPath("$.dfa_scales").isArray();
    }

    @Test
    void shouldGenerateSyntheticSignal() {
        webTestClient.post()
                .uri("/api/v1/analyze/synthetic")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"type": "Drifting", "length": 50, "seed": 42}
                    """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length").isEqualTo(50)
                .jsonPath("$.data.length()").isEqualTo(50)
                .jsonPath("$.timestamps[49]").isEqualTo(10.0)
                .jsonPath("$.seed").isEqualTo(42);
    }

    @Test
    void shouldRejectUnknownSignalType() {
        webTestClient.post()
                .uri("/api/v1/analyze/synthetic")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"type": "Chaotic"}
                    """)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void shouldRejectTooShortSyntheticSignal() {
        webTestClient.post()
                .uri("/api/v1/analyze/synthetic")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"type": "Normal", "length": 5}
                    """)
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void shouldAcceptReading() {
        Instant ts = Instant.parse("2024-01-15T10:30:00Z");
        when(analysisService.ingestReading("pump-1", 65.5, ts)).thenReturn(Mono.just(ts));

        webTestClient.post()
                .uri("/api/v1/analyze/readings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                    {"sensor_id": "pump-1", "value": 65.5, "timestamp": "2024-01-15T10:30:00Z"}
                    """)
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.status").isEqualTo("received")
                .jsonPath("$.sensor_id").isEqualTo("pump-1");
    }

    @Test
    void shouldReportHealth() {
        webTestClient.get()
                .uri("/api/v1/analyze/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("OK");
    }
}
