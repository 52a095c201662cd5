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
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single irregularity detected in a query result")
public class Anomaly {

    @Schema(description = "Unique anomaly identifier", example = "6f1c2a34-9b1e-4d0a-8a57-1d2f3c4b5a69")
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Schema(description = "Kind of anomaly", example = "STATISTICAL")
    private AnomalyType type;

    @Schema(description = "Final severity after contextual escalation", example = "HIGH")
    private AnomalySeverity severity;

    @Schema(description = "Detection confidence in [0, 1]", example = "0.87")
    private double confidence;

    @Schema(description = "Human-readable explanation",
            example = "Statistical outlier detected in TotalRevenue (Z-Score: 4.35)")
    private String description;

    @Schema(description = "Column the anomaly was found in", example = "TotalRevenue")
    private String affectedColumn;

    @Schema(description = "Zero-based indices of the affected result rows", example = "[12, 40]")
    @Builder.Default
    private List<Integer> affectedRows = new ArrayList<>();

    @Schema(description = "Expected value or range, for explanation only", example = "1520.5")
    private Object expectedValue;

    @Schema(description = "Observed value, for explanation only", example = "98000.0")
    private Object actualValue;

    @Schema(description = "Algorithm(s) that produced this anomaly", example = "Z-Score, IQR")
    private String detectionMethod;

    @Schema(description = "Detection timestamp", example = "2025-02-18T13:52:44Z")
    @Builder.Default
    private Instant detectedAt = Instant.now();

    @Schema(description = "Provenance data (z-score, IQR bounds, merged source ids, ...)")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public Integer firstAffectedRow() {
        return (affectedRows == null || affectedRows.isEmpty()) ? null : affectedRows.get(0);
    }
}
