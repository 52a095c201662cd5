package com.bireporting.anomaly.controller;

import com.bireporting.anomaly.config.AerospikeConfig;
import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.exception.InvalidConfigurationException;
import com.bireporting.anomaly.model.AnomalyDetectionConfiguration;
import com.bireporting.anomaly.model.BusinessRule;
import com.bireporting.anomaly.service.DetectionConfigurationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify detection configuration (toggles, limits, thresholds, business rules)")
public class DetectionConfigController {

    private final DetectionConfigurationService configurationService;
    private final AerospikeConfig aerospikeConfig;

    public DetectionConfigController(DetectionConfigurationService configurationService,
                                     AerospikeConfig aerospikeConfig) {
        this.configurationService = configurationService;
        this.aerospikeConfig = aerospikeConfig;
    }

    // ── Global configuration ──

    @Operation(summary = "Get detector toggles and detection limits")
    @GetMapping("/anomaly")
    public ResponseEntity<Map<String, Object>> getAnomalyConfiguration() {
        AnomalyConfiguration config = configurationService.getAnomalyConfiguration();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enableStatisticalDetection", config.isEnableStatisticalDetection());
        body.put("enableTemporalDetection", config.isEnableTemporalDetection());
        body.put("enablePatternDetection", config.isEnablePatternDetection());
        body.put("enableBusinessRuleDetection", config.isEnableBusinessRuleDetection());
        body.put("minimumConfidenceThreshold", config.getMinimumConfidenceThreshold());
        body.put("maxAnomaliesPerQuery", config.getMaxAnomaliesPerQuery());
        body.put("enableRealTimeAlerts", config.isEnableRealTimeAlerts());
        body.put("alertCooldownPeriod", config.getAlertCooldownPeriod().toString());
        body.put("alertCacheTtl", config.getAlertCacheTtl().toString());
        body.put("detectionTimeout", config.getDetectionTimeout().toString());
        body.put("configCacheTtl", config.getConfigCacheTtl().toString());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Update detector toggles and detection limits",
            description = "Omitted fields keep their current value. Durations accept ISO-8601 (PT15M) or " +
                    "simple form (15m); plain numbers are seconds. Changes apply to runs started afterwards " +
                    "and reset on restart.")
    @PutMapping("/anomaly")
    public ResponseEntity<?> updateAnomalyConfiguration(@RequestBody Map<String, Object> body) {
        AnomalyConfiguration update = configurationService.getAnomalyConfiguration();
        try {
            update.setEnableStatisticalDetection(toBool(body, "enableStatisticalDetection", update.isEnableStatisticalDetection()));
            update.setEnableTemporalDetection(toBool(body, "enableTemporalDetection", update.isEnableTemporalDetection()));
            update.setEnablePatternDetection(toBool(body, "enablePatternDetection", update.isEnablePatternDetection()));
            update.setEnableBusinessRuleDetection(toBool(body, "enableBusinessRuleDetection", update.isEnableBusinessRuleDetection()));
            update.setMinimumConfidenceThreshold(toDouble(body, "minimumConfidenceThreshold", update.getMinimumConfidenceThreshold()));
            update.setMaxAnomaliesPerQuery(toInt(body, "maxAnomaliesPerQuery", update.getMaxAnomaliesPerQuery()));
            update.setEnableRealTimeAlerts(toBool(body, "enableRealTimeAlerts", update.isEnableRealTimeAlerts()));
            update.setAlertCooldownPeriod(toDuration(body, "alertCooldownPeriod", update.getAlertCooldownPeriod()));
            update.setAlertCacheTtl(toDuration(body, "alertCacheTtl", update.getAlertCacheTtl()));
            update.setDetectionTimeout(toDuration(body, "detectionTimeout", update.getDetectionTimeout()));
            update.setConfigCacheTtl(toDuration(body, "configCacheTtl", update.getConfigCacheTtl()));

            configurationService.updateAnomalyConfiguration(update);
        } catch (InvalidConfigurationException e) {
            return badRequest(e.getMessage(), e.getField());
        }
        return getAnomalyConfiguration();
    }

    // ── Detector configuration ──

    @Operation(summary = "Get detector thresholds, parameters and business rules")
    @GetMapping("/detection")
    public ResponseEntity<AnomalyDetectionConfiguration> getDetectionConfiguration() {
        return ResponseEntity.ok(configurationService.getDetectionConfiguration());
    }

    @Operation(summary = "Update detector thresholds, parameters and business rules",
            description = "Each present section replaces that detector's settings; omitted sections are unchanged. " +
                    "businessRules replaces the whole rule list. The update is validated as a whole " +
                    "(including every rule condition) and persisted for 30 days.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetectionConfiguration(@RequestBody AnomalyDetectionConfiguration body) {
        try {
            return ResponseEntity.ok(configurationService.updateDetectionConfiguration(body));
        } catch (InvalidConfigurationException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    @Operation(summary = "Get the current business rules")
    @GetMapping("/rules")
    public ResponseEntity<List<BusinessRule>> getRules() {
        return ResponseEntity.ok(configurationService.getDetectionConfiguration().getBusinessRules());
    }

    // ── Aerospike (read-only) ──

    @Operation(summary = "Get Aerospike connection info (read-only)")
    @GetMapping("/aerospike")
    public ResponseEntity<Map<String, Object>> getAerospikeInfo() {
        return ResponseEntity.ok(Map.of(
                "host", aerospikeConfig.getHost(),
                "port", aerospikeConfig.getPort(),
                "namespace", aerospikeConfig.getNamespace()
        ));
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(v.toString());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key, key + " is not a number: " + v);
        }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(v.toString());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(key, key + " is not an integer: " + v);
        }
    }

    private boolean toBool(Map<String, Object> body, String key, boolean defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Boolean b) return b;
        if ("true".equalsIgnoreCase(v.toString())) return true;
        if ("false".equalsIgnoreCase(v.toString())) return false;
        throw new InvalidConfigurationException(key, key + " must be true or false: " + v);
    }

    private Duration toDuration(Map<String, Object> body, String key, Duration defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return Duration.ofSeconds(n.longValue());
        try {
            return DurationStyle.detectAndParse(v.toString(), ChronoUnit.SECONDS);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(key, key + " is not a valid duration: " + v);
        }
    }
}
