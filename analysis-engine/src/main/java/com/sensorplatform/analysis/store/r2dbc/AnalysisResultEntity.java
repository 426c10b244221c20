package com.sensorplatform.analysis.store.r2dbc;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Persisted {@link com.sensorplatform.analysis.model.AnalysisReport}.
 *
 * flags   : JSON-serialised {@code List<String>}
 * metrics : JSON-serialised {@code DescriptorBundle}
 */
@Data
@NoArgsConstructor
@Table("analysis_results")
public class AnalysisResultEntity {

    @Id
    private Long id;

    private String sensorId;

    private LocalDateTime analyzedAt;

    private double healthScore;

    /** Status label, e.g. {@code "Warning"} */
    private String status;

    private String diagnosis;

    /** JSON-serialised {@code List<String>} */
    private String flags;

    private String recommendation;

    private String prediction;

    /** JSON-serialised {@code DescriptorBundle} */
    private String metrics;
}
