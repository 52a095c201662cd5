package com.bireporting.anomaly.service;

import com.bireporting.anomaly.cache.CacheService;
import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.engine.DetectionEngine;
import com.bireporting.anomaly.engine.condition.CompiledCondition;
import com.bireporting.anomaly.engine.detectors.BusinessRuleAnomalyDetector;
import com.bireporting.anomaly.engine.detectors.PatternAnomalyDetector;
import com.bireporting.anomaly.engine.detectors.StatisticalAnomalyDetector;
import com.bireporting.anomaly.engine.detectors.TemporalAnomalyDetector;
import com.bireporting.anomaly.exception.ConditionSyntaxException;
import com.bireporting.anomaly.exception.InvalidConfigurationException;
import com.bireporting.anomaly.model.AnomalyDetectionConfiguration;
import com.bireporting.anomaly.model.BusinessRule;
import com.bireporting.anomaly.model.PatternDetectionSettings;
import com.bireporting.anomaly.model.StatisticalThresholds;
import com.bireporting.anomaly.model.TemporalParameters;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the runtime configuration: the global toggles and limits, and the per-detector
 * settings.
 *
 * Updates are validated completely before anything is applied, so a rejected update
 * leaves every detector as it was. Per-detector settings are persisted under
 * {@value #CONFIG_CACHE_KEY} and restored on startup.
 */
@Service
public class DetectionConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(DetectionConfigurationService.class);

    public static final String CONFIG_CACHE_KEY = "anomaly_detection_config";

    private final AtomicReference<AnomalyConfiguration> current;
    private final DetectionEngine detectionEngine;
    private final StatisticalAnomalyDetector statisticalDetector;
    private final TemporalAnomalyDetector temporalDetector;
    private final PatternAnomalyDetector patternDetector;
    private final BusinessRuleAnomalyDetector businessRuleDetector;
    private final CacheService cacheService;

    public DetectionConfigurationService(AnomalyConfiguration startupConfig,
                                         DetectionEngine detectionEngine,
                                         StatisticalAnomalyDetector statisticalDetector,
                                         TemporalAnomalyDetector temporalDetector,
                                         PatternAnomalyDetector patternDetector,
                                         BusinessRuleAnomalyDetector businessRuleDetector,
                                         CacheService cacheService) {
        this.current = new AtomicReference<>(startupConfig.copy());
        this.detectionEngine = detectionEngine;
        this.statisticalDetector = statisticalDetector;
        this.temporalDetector = temporalDetector;
        this.patternDetector = patternDetector;
        this.businessRuleDetector = businessRuleDetector;
        this.cacheService = cacheService;
    }

    /**
     * Re-apply detector settings persisted by an earlier update. The store may be down
     * at startup; the configured defaults then stay in effect.
     */
    @PostConstruct
    public void restorePersistedConfiguration() {
        Optional<AnomalyDetectionConfiguration> persisted;
        try {
            persisted = cacheService.get(CONFIG_CACHE_KEY, AnomalyDetectionConfiguration.class);
        } catch (RuntimeException e) {
            log.warn("Could not load persisted detection configuration, using defaults: {}", e.getMessage());
            return;
        }

        if (persisted.isEmpty()) {
            log.info("No persisted detection configuration found, using defaults");
            return;
        }

        try {
            validate(persisted.get());
            apply(persisted.get());
            log.info("Restored persisted detection configuration");
        } catch (InvalidConfigurationException e) {
            log.warn("Ignoring invalid persisted detection configuration ({}: {})", e.getField(), e.getMessage());
        }
    }

    /** Snapshot of the global configuration. Changes to it have no effect until passed to an update. */
    public AnomalyConfiguration getAnomalyConfiguration() {
        return current.get().copy();
    }

    /**
     * Replace the global toggles and limits and re-select the active detectors.
     * The nested detector defaults are not read from {@code update}; use
     * {@link #updateDetectionConfiguration} for detector settings.
     *
     * @throws InvalidConfigurationException if any value is out of range
     */
    public AnomalyConfiguration updateAnomalyConfiguration(AnomalyConfiguration update) {
        validateGlobal(update);

        AnomalyConfiguration next = update.copy();
        AnomalyConfiguration previous = current.get();
        next.setStatistical(previous.getStatistical());
        next.setTemporal(previous.getTemporal());
        next.setPattern(previous.getPattern());
        next.setCache(previous.getCache());
        next.setExecutor(previous.getExecutor());

        current.set(next);
        detectionEngine.activate(next);
        log.info("Anomaly configuration updated: maxAnomalies={}, realTimeAlerts={}, cooldown={}",
                next.getMaxAnomaliesPerQuery(), next.isEnableRealTimeAlerts(), next.getAlertCooldownPeriod());
        return next.copy();
    }

    /** Detector settings currently in effect. */
    public AnomalyDetectionConfiguration getDetectionConfiguration() {
        return AnomalyDetectionConfiguration.builder()
                .statisticalThresholds(statisticalDetector.getThresholds())
                .temporalParameters(temporalDetector.getParameters())
                .patternSettings(patternDetector.getSettings())
                .businessRules(businessRuleDetector.getRules())
                .build();
    }

    /**
     * Replace the settings of every detector whose section is present, then persist the
     * complete resulting configuration.
     *
     * @throws InvalidConfigurationException if any section is invalid; nothing is applied
     */
    public AnomalyDetectionConfiguration updateDetectionConfiguration(AnomalyDetectionConfiguration update) {
        log.info("Updating anomaly detection configuration");
        AnomalyDetectionConfiguration normalized = normalizeRuleIds(update);
        validate(normalized);
        apply(normalized);

        AnomalyDetectionConfiguration effective = getDetectionConfiguration();
        Duration ttl = current.get().getConfigCacheTtl();
        try {
            cacheService.set(CONFIG_CACHE_KEY, effective, ttl);
        } catch (RuntimeException e) {
            log.error("Detection configuration applied but could not be persisted: {}", e.getMessage(), e);
        }

        log.info("Anomaly detection configuration updated successfully");
        return effective;
    }

    private void apply(AnomalyDetectionConfiguration config) {
        if (config.getStatisticalThresholds() != null) {
            statisticalDetector.updateThresholds(config.getStatisticalThresholds());
        }
        if (config.getTemporalParameters() != null) {
            temporalDetector.updateParameters(config.getTemporalParameters());
        }
        if (config.getPatternSettings() != null) {
            patternDetector.updateSettings(config.getPatternSettings());
        }
        if (config.getBusinessRules() != null) {
            businessRuleDetector.updateRules(config.getBusinessRules());
        }
    }

    private static AnomalyDetectionConfiguration normalizeRuleIds(AnomalyDetectionConfiguration update) {
        if (update.getBusinessRules() == null) return update;

        List<BusinessRule> rules = new ArrayList<>();
        for (BusinessRule rule : update.getBusinessRules()) {
            if (rule != null && (rule.getId() == null || rule.getId().isBlank())) {
                rules.add(rule.toBuilder().id(UUID.randomUUID().toString()).build());
            } else {
                rules.add(rule);
            }
        }
        return AnomalyDetectionConfiguration.builder()
                .statisticalThresholds(update.getStatisticalThresholds())
                .temporalParameters(update.getTemporalParameters())
                .patternSettings(update.getPatternSettings())
                .businessRules(rules)
                .build();
    }

    // --- validation ---

    static void validateGlobal(AnomalyConfiguration config) {
        double minConfidence = config.getMinimumConfidenceThreshold();
        if (minConfidence < 0 || minConfidence > 1) {
            throw new InvalidConfigurationException("minimumConfidenceThreshold",
                    "minimumConfidenceThreshold must be between 0 and 1");
        }
        if (config.getMaxAnomaliesPerQuery() < 1) {
            throw new InvalidConfigurationException("maxAnomaliesPerQuery",
                    "maxAnomaliesPerQuery must be at least 1");
        }
        requireNonNegative("alertCooldownPeriod", config.getAlertCooldownPeriod());
        requirePositive("alertCacheTtl", config.getAlertCacheTtl());
        if (config.getAlertCacheTtl().compareTo(config.getAlertCooldownPeriod()) < 0) {
            throw new InvalidConfigurationException("alertCacheTtl",
                    "alertCacheTtl must not be shorter than alertCooldownPeriod");
        }
        requirePositive("detectionTimeout", config.getDetectionTimeout());
        requirePositive("configCacheTtl", config.getConfigCacheTtl());
    }

    static void validate(AnomalyDetectionConfiguration config) {
        StatisticalThresholds thresholds = config.getStatisticalThresholds();
        if (thresholds != null) {
            if (thresholds.getZscoreThreshold() <= 0) {
                throw new InvalidConfigurationException("statisticalThresholds.zscoreThreshold",
                        "zscoreThreshold must be positive");
            }
            if (thresholds.getIqrMultiplier() <= 0) {
                throw new InvalidConfigurationException("statisticalThresholds.iqrMultiplier",
                        "iqrMultiplier must be positive");
            }
            if (thresholds.getPercentileThreshold() <= 0 || thresholds.getPercentileThreshold() > 1) {
                throw new InvalidConfigurationException("statisticalThresholds.percentileThreshold",
                        "percentileThreshold must be in (0, 1]");
            }
            if (thresholds.getMinimumSampleSize() < 1) {
                throw new InvalidConfigurationException("statisticalThresholds.minimumSampleSize",
                        "minimumSampleSize must be at least 1");
            }
        }

        TemporalParameters temporal = config.getTemporalParameters();
        if (temporal != null) {
            if (temporal.getSeasonalityPeriod() < 1) {
                throw new InvalidConfigurationException("temporalParameters.seasonalityPeriod",
                        "seasonalityPeriod must be at least 1");
            }
            if (temporal.getMovingAverageWindow() < 1) {
                throw new InvalidConfigurationException("temporalParameters.movingAverageWindow",
                        "movingAverageWindow must be at least 1");
            }
            if (temporal.getTrendThreshold() < 0) {
                throw new InvalidConfigurationException("temporalParameters.trendThreshold",
                        "trendThreshold must not be negative");
            }
            if (temporal.getVolatilityThreshold() < 0) {
                throw new InvalidConfigurationException("temporalParameters.volatilityThreshold",
                        "volatilityThreshold must not be negative");
            }
        }

        PatternDetectionSettings pattern = config.getPatternSettings();
        if (pattern != null) {
            if (pattern.getSimilarityThreshold() < 0 || pattern.getSimilarityThreshold() > 1) {
                throw new InvalidConfigurationException("patternSettings.similarityThreshold",
                        "similarityThreshold must be between 0 and 1");
            }
            if (pattern.getMinimumPatternLength() < 1) {
                throw new InvalidConfigurationException("patternSettings.minimumPatternLength",
                        "minimumPatternLength must be at least 1");
            }
        }

        if (config.getBusinessRules() != null) {
            validateRules(config.getBusinessRules());
        }
    }

    private static void validateRules(List<BusinessRule> rules) {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            BusinessRule rule = rules.get(i);
            String field = "businessRules[" + i + "]";
            if (rule == null) {
                throw new InvalidConfigurationException(field, "Rule must not be null");
            }
            if (rule.getName() == null || rule.getName().isBlank()) {
                throw new InvalidConfigurationException(field + ".name", "Rule name is required");
            }
            if (rule.getSeverity() == null) {
                throw new InvalidConfigurationException(field + ".severity", "Rule severity is required");
            }
            if (rule.getId() != null && !ids.add(rule.getId())) {
                throw new InvalidConfigurationException(field + ".id", "Duplicate rule id: " + rule.getId());
            }
            try {
                CompiledCondition.compile(rule.getCondition());
            } catch (ConditionSyntaxException e) {
                throw new InvalidConfigurationException(field + ".condition", e.getMessage(), e);
            }
        }
    }

    private static void requirePositive(String field, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new InvalidConfigurationException(field, field + " must be positive");
        }
    }

    private static void requireNonNegative(String field, Duration value) {
        if (value == null || value.isNegative()) {
            throw new InvalidConfigurationException(field, field + " must not be negative");
        }
    }
}
