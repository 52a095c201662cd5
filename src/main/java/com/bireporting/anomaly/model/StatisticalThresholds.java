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
@Schema(description = "Thresholds for the Z-score and IQR outlier tests")
public class StatisticalThresholds {

    @Schema(description = "Flag values whose |z| exceeds this", example = "3.0")
    @Builder.Default
    private double zscoreThreshold = 3.0;

    @Schema(description = "IQR fence multiplier k", example = "1.5")
    @Builder.Default
    private double iqrMultiplier = 1.5;

    @Schema(description = "Percentile threshold, in (0, 1]", example = "0.95")
    @Builder.Default
    private double percentileThreshold = 0.95;

    @Schema(description = "Columns with fewer numeric values are skipped", example = "30")
    @Builder.Default
    private int minimumSampleSize = 30;
}
