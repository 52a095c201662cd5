package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the upstream semantic analyser for the question that produced a query
 * result. Part of every detector's input; no shipped detector reads it yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Semantic analysis of the originating natural-language query")
public class SemanticAnalysis {

    @Schema(description = "Original question", example = "Show daily revenue for January")
    private String originalQuery;

    @Schema(description = "Detected intent", example = "AGGREGATION")
    private String intent;

    @Schema(description = "Extracted entities")
    @Builder.Default
    private List<SemanticEntity> entities = new ArrayList<>();

    @Schema(description = "Analyser confidence", example = "0.92")
    private double confidence;

    public static SemanticAnalysis empty() {
        return SemanticAnalysis.builder().build();
    }
}
