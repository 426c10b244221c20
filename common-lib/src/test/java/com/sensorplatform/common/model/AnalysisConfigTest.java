package com.sensorplatform.common.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.sensorplatform.common.exception.SensorAnalysisException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisConfigTest {

    @Nested
    @DisplayName("defaults and validation")
    class ValidationTests {

        @Test
        @DisplayName("defaults match the documented thresholds")
        void defaults() {
            AnalysisConfig c = AnalysisConfig.defaults();
            assertEquals(0.1, c.slopeCritical());
            assertEquals(0.05, c.slopeWarning());
            assertEquals(2.0, c.biasCritical());
            assertEquals(1.0, c.biasWarning());
            assertEquals(1.5, c.noiseCritical());
            assertEquals(0.5, c.hysteresisCritical());
            assertEquals(0.8, c.dfaCritical());
            assertEquals(50, c.minDataPoints());
            assertEquals(0.0, c.biasReference());
        }

        @Test
        @DisplayName("warning above critical → INVALID_INPUT")
        void warningAboveCritical() {
            SensorAnalysisException ex = assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.builder().slopeWarning(0.3).build());
            assertTrue(ex.isInvalidInput());
        }

        @Test
        @DisplayName("min_data_points below the hard floor → INVALID_INPUT")
        void minPointsBelowFloor() {
            assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.builder().minDataPoints(4).build());
            assertEquals(5, AnalysisConfig.builder().minDataPoints(5).build().effectiveMinimum());
        }

        @Test
        @DisplayName("non-finite or negative thresholds → INVALID_INPUT")
        void nonFinite() {
            assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.builder().noiseCritical(Double.NaN).build());
            assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.builder().noiseCritical(-1).build());
            assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.builder().rulDriftLimit(0).build());
        }
    }

    @Nested
    @DisplayName("fromMap()")
    class FromMapTests {

        @Test
        @DisplayName("null or empty map → defaults")
        void emptyMap() {
            assertEquals(AnalysisConfig.defaults(), AnalysisConfig.fromMap(null));
            assertEquals(AnalysisConfig.defaults(), AnalysisConfig.fromMap(Map.of()));
        }

        @Test
        @DisplayName("partial map overrides only the given fields")
        void partialOverride() {
            AnalysisConfig c = AnalysisConfig.fromMap(Map.of("noise_critical", 0.7, "min_data_points", 20));
            assertEquals(0.7, c.noiseCritical());
            assertEquals(20, c.minDataPoints());
            assertEquals(AnalysisConfig.DEFAULT_SLOPE_CRITICAL, c.slopeCritical());
        }

        @Test
        @DisplayName("partial map over a custom base keeps the base's other fields")
        void overlayOnBase() {
            AnalysisConfig base = AnalysisConfig.builder().minDataPoints(20).noiseCritical(2.5).build();

            AnalysisConfig c = AnalysisConfig.fromMap(base, Map.of("slope_critical", 0.2));
            assertEquals(0.2, c.slopeCritical());
            assertEquals(20, c.minDataPoints());
            assertEquals(2.5, c.noiseCritical());
            assertSame(base, AnalysisConfig.fromMap(base, Map.of()));
            assertSame(base, AnalysisConfig.fromMap(base, null));
        }

        @Test
        @DisplayName("override that conflicts with the base → INVALID_INPUT")
        void overlayValidated() {
            AnalysisConfig base = AnalysisConfig.builder().slopeCritical(0.3).slopeWarning(0.2).build();
            assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.fromMap(base, Map.of("slope_critical", 0.1)));
        }

        @Test
        @DisplayName("null value for a known key → default")
        void nullValue() {
            Map<String, Object> values = new HashMap<>();
            values.put("bias_critical", null);
            assertEquals(2.0, AnalysisConfig.fromMap(values).biasCritical());
        }

        @Test
        @DisplayName("unknown key → INVALID_INPUT naming it")
        void unknownKey() {
            SensorAnalysisException ex = assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.fromMap(Map.of("slope_critcal", 0.2)));
            assertTrue(ex.getMessage().contains("slope_critcal"));
        }

        @Test
        @DisplayName("non-numeric or fractional values → INVALID_INPUT")
        void badValues() {
            assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.fromMap(Map.of("noise_critical", "high")));
            assertThrows(SensorAnalysisException.class,
                () -> AnalysisConfig.fromMap(Map.of("min_data_points", 12.5)));
        }
    }

    @Nested
    @DisplayName("JSON binding")
    class JsonTests {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("missing fields take defaults")
        void missingFieldsDefault() throws Exception {
            AnalysisConfig c = mapper.readValue("{\"slope_critical\":0.2}", AnalysisConfig.class);
            assertEquals(0.2, c.slopeCritical());
            assertEquals(AnalysisConfig.DEFAULT_NOISE_CRITICAL, c.noiseCritical());
        }

        @Test
        @DisplayName("serializes with snake_case names and reads back equal")
        void snakeCase() throws Exception {
            AnalysisConfig c = AnalysisConfig.builder().biasReference(12.0).build();
            String json = mapper.writeValueAsString(c);
            assertTrue(json.contains("\"bias_reference\":12.0"), json);
            assertEquals(c, mapper.readValue(json, AnalysisConfig.class));
        }

        @Test
        @DisplayName("unknown JSON field is rejected")
        void unknownField() {
            assertThrows(UnrecognizedPropertyException.class,
                () -> mapper.readValue("{\"noise_limit\":1.0}", AnalysisConfig.class));
        }

        @Test
        @DisplayName("invalid JSON thresholds surface the validation error")
        void invalidThreshold() {
            JsonProcessingException ex = assertThrows(JsonProcessingException.class,
                () -> mapper.readValue("{\"bias_warning\":5.0}", AnalysisConfig.class));
            assertInstanceOf(SensorAnalysisException.class, ex.getCause());
        }
    }
}
