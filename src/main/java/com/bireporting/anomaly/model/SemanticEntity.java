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
@Schema(description = "Entity extracted from the natural-language question")
public class SemanticEntity {

    @Schema(description = "Entity text", example = "revenue")
    private String name;

    @Schema(description = "Entity category", example = "METRIC")
    private String type;

    @Schema(description = "Resolved value, if any", example = "TotalRevenue")
    private String value;
}
