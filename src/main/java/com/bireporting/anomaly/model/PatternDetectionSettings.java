package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Settings for sequence and frequency pattern detection")
public class PatternDetectionSettings {

    @Schema(description = "Similarity in [0, 1] above which sequences are considered alike", example = "0.8")
    @Builder.Default
    private double similarityThreshold = 0.8;

    @Schema(description = "Shortest sequence considered a pattern", example = "3")
    @Builder.Default
    private int minimumPatternLength = 3;

    @Schema(description = "Look for repeated sequences", example = "true")
    @Builder.Default
    private boolean enableSequenceDetection = true;

    @Schema(description = "Look for unusual value frequencies", example = "true")
    @Builder.Default
    private boolean enableFrequencyAnalysis = true;
}
