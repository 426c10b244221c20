package com.sensorplatform.analysis.store.r2dbc;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One stored sensor reading.
 *
 * <p>{@code readingValue} is nullable: a missing measurement is kept as a row so the
 * series preserves its gaps, and the preprocessor drops it at analysis time.
 */
@Data
@NoArgsConstructor
@Table("sensor_readings")
public class SensorReadingEntity {

    @Id
    private Long id;

    private String sensorId;

    private Double readingValue;

    private LocalDateTime recordedAt;
}
