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
@Schema(description = "Suggested follow-up action for a set of anomalies")
public class AnomalyRecommendation {

    @Schema(description = "Recommendation kind", example = "INVESTIGATION")
    private RecommendationType type;

    @Schema(description = "Short title", example = "Investigate Statistical Outliers")
    private String title;

    @Schema(description = "What to do",
            example = "Review data collection processes and validate unusual statistical patterns")
    private String description;

    @Schema(description = "Priority", example = "MEDIUM")
    private RecommendationPriority priority;

    @Schema(description = "Rough effort estimate", example = "2-4 hours")
    private String estimatedEffort;

    @Schema(description = "Ids of the anomalies this recommendation addresses")
    @Builder.Default
    private List<String> affectedAnomalies = new ArrayList<>();
}
