package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Observation derived from a group of anomalies")
public class AnomalyInsight {

    @Schema(description = "Insight kind", example = "PATTERN")
    private InsightType type;

    @Schema(description = "Short title", example = "STATISTICAL Anomaly Pattern")
    private String title;

    @Schema(description = "Explanation",
            example = "Detected 3 statistical outliers with average confidence 82.4%")
    private String description;

    @Schema(description = "Average confidence of the contributing anomalies", example = "0.82")
    private double confidence;

    @Schema(description = "Ids of the contributing anomalies")
    @Builder.Default
    private List<String> affectedAnomalies = new ArrayList<>();
}
