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
@Schema(description = "Parameters for time-based detection")
public class TemporalParameters {

    @Schema(description = "Seasonality period in days", example = "7")
    @Builder.Default
    private int seasonalityPeriod = 7;

    @Schema(description = "Relative change that counts as a trend", example = "0.2")
    @Builder.Default
    private double trendThreshold = 0.2;

    @Schema(description = "Moving average window, in points", example = "7")
    @Builder.Default
    private int movingAverageWindow = 7;

    @Schema(description = "Coefficient of variation that counts as volatile", example = "0.3")
    @Builder.Default
    private double volatilityThreshold = 0.3;
}
