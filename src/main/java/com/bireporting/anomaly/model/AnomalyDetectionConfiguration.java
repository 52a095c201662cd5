package com.bireporting.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-detector settings. On update, each non-null section replaces the corresponding
 * detector's settings as a whole; null sections leave the detector untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-detector configuration; null sections are left unchanged on update")
public class AnomalyDetectionConfiguration {

    @Schema(description = "Statistical detector thresholds")
    private StatisticalThresholds statisticalThresholds;

    @Schema(description = "Temporal detector parameters")
    private TemporalParameters temporalParameters;

    @Schema(description = "Complete replacement list of business rules")
    private List<BusinessRule> businessRules;

    @Schema(description = "Pattern detector settings")
    private PatternDetectionSettings patternSettings;
}
