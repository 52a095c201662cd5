package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Query result to scan, with the analysis of the question that produced it")
public class DetectionRequest {

    @Schema(description = "Result rows and columns to analyse")
    private QueryResult queryResult;

    @Schema(description = "Semantic analysis of the originating question (optional)")
    private SemanticAnalysis semanticAnalysis;

    @Schema(description = "Requesting user; alerts are de-duplicated per user", example = "analyst-42")
    private String userId;
}
