package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of running all enabled detectors over one query result")
public class AnomalyDetectionResult {

    @Schema(description = "Anomalies ranked by severity, then confidence")
    @Builder.Default
    private List<Anomaly> anomalies = new ArrayList<>();

    @Schema(description = "Number of anomalies returned", example = "4")
    private int totalAnomalies;

    @Schema(description = "Number of CRITICAL anomalies", example = "0")
    private int criticalSeverityCount;

    @Schema(description = "Number of HIGH anomalies", example = "2")
    private int highSeverityCount;

    @Schema(description = "Number of MEDIUM anomalies", example = "1")
    private int mediumSeverityCount;

    @Schema(description = "Number of LOW anomalies", example = "1")
    private int lowSeverityCount;

    @Schema(description = "Insights derived from the anomalies")
    @Builder.Default
    private List<AnomalyInsight> insights = new ArrayList<>();

    @Schema(description = "Recommended follow-up actions")
    @Builder.Default
    private List<AnomalyRecommendation> recommendations = new ArrayList<>();

    @Schema(description = "Number of detectors invoked", example = "4")
    private int detectionMethods;

    @Schema(description = "When processing finished", example = "2025-02-18T13:52:44Z")
    private Instant processingTime;

    @Schema(description = "Run metadata: row/column counts, user, detectors used, error flag")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public boolean isError() {
        return Boolean.TRUE.equals(metadata.get("error"));
    }
}
