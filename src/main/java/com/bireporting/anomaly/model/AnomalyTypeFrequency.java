package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "How often an anomaly type occurred within a period")
public record AnomalyTypeFrequency(
        @Schema(description = "Anomaly type", example = "OUTLIER") AnomalyType type,
        @Schema(description = "Occurrences", example = "12") int count,
        @Schema(description = "Share of all anomalies, in percent", example = "37.5") double percentage) {}
