package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregated view of anomalies detected over a period")
public class AnomalyTrendAnalysis {

    @Schema(description = "Analysed period (ISO-8601 duration)", example = "PT720H")
    private Duration period;

    @Schema(description = "Anomalies detected in the period", example = "32")
    private int totalAnomalies;

    @Schema(description = "Anomaly count per UTC day")
    @Builder.Default
    private Map<LocalDate, Integer> anomaliesByDay = new TreeMap<>();

    @Schema(description = "Anomaly count per type")
    @Builder.Default
    private Map<AnomalyType, Integer> anomaliesByType = new EnumMap<>(AnomalyType.class);

    @Schema(description = "Anomaly count per severity")
    @Builder.Default
    private Map<AnomalySeverity, Integer> anomaliesBySeverity = new EnumMap<>(AnomalySeverity.class);

    @Schema(description = "Direction of the last 7 days compared with the rest of the period", example = "STABLE")
    @Builder.Default
    private TrendDirection trendDirection = TrendDirection.STABLE;

    @Schema(description = "Up to five most frequent anomaly types")
    @Builder.Default
    private List<AnomalyTypeFrequency> mostCommonAnomalies = new ArrayList<>();

    @Schema(description = "Suggested actions derived from the trend")
    @Builder.Default
    private List<String> recommendedActions = new ArrayList<>();

    @Schema(description = "When the analysis was produced", example = "2025-02-18T13:52:44Z")
    private Instant generatedAt;
}
