package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Bookkeeping for the last detector training run")
public class AnomalyModelMetadata {

    @Schema(description = "Number of historical query results used", example = "120")
    private int trainingDataCount;

    @Schema(description = "When training finished", example = "2025-02-18T13:52:44Z")
    private Instant lastTrainingDate;

    @Schema(description = "Model version", example = "1.0")
    private String modelVersion;

    @Schema(description = "User that triggered training", example = "analyst-42")
    private String userId;

    @Schema(description = "Settings in effect during training")
    @Builder.Default
    private Map<String, Object> modelParameters = new HashMap<>();
}
