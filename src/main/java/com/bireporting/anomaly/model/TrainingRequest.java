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
@Schema(description = "Historical query results to train the detectors with")
public class TrainingRequest {

    @Schema(description = "Historical query results")
    @Builder.Default
    private List<QueryResult> historicalData = new ArrayList<>();

    @Schema(description = "User triggering the training run", example = "analyst-42")
    private String userId;
}
