package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Named condition that flags every result row it matches")
public class BusinessRule {

    @Schema(description = "Unique rule identifier", example = "RULE-NEG-REVENUE")
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    @Schema(description = "Rule display name", example = "Negative Revenue")
    private String name;

    @Schema(description = "What the rule guards against", example = "Revenue values should not be negative")
    private String description;

    @Schema(description = "Condition over column references and literals; a row matching it is a violation",
            example = "revenue < 0 AND region != 'TEST'")
    private String condition;

    @Schema(description = "Severity assigned to violations", example = "HIGH")
    private AnomalySeverity severity;

    @Schema(description = "Only enabled rules are evaluated", example = "true")
    @Builder.Default
    private boolean enabled = true;
}
