package com.bireporting.anomaly.config;

import com.bireporting.anomaly.model.PatternDetectionSettings;
import com.bireporting.anomaly.model.StatisticalThresholds;
import com.bireporting.anomaly.model.TemporalParameters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Global detection settings. The Spring-bound instance only supplies startup values;
 * at runtime the pipeline reads immutable-by-convention snapshots produced by
 * {@link #copy()} and swapped in by the configuration service.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyConfiguration {

    private boolean enableStatisticalDetection = true;
    private boolean enableTemporalDetection = true;
    private boolean enablePatternDetection = true;
    private boolean enableBusinessRuleDetection = true;

    // Reported with every result; anomalies below it are still returned.
    private double minimumConfidenceThreshold = 0.7;

    // Ranked anomalies beyond this are cut from the returned result (after alerting).
    private int maxAnomaliesPerQuery = 50;

    private boolean enableRealTimeAlerts = true;

    // Same (type, column, user) alert is suppressed within this window.
    private Duration alertCooldownPeriod = Duration.ofMinutes(15);

    // Lifetime of the cooldown marker in the cache. Must be >= alertCooldownPeriod.
    private Duration alertCacheTtl = Duration.ofMinutes(30);

    // Deadline for the whole detector fan-out. Late detectors contribute nothing.
    private Duration detectionTimeout = Duration.ofSeconds(10);

    // How long persisted detector configuration and model metadata are kept.
    private Duration configCacheTtl = Duration.ofDays(30);

    // Startup defaults for the individual detectors.
    private StatisticalThresholds statistical = new StatisticalThresholds();
    private TemporalParameters temporal = new TemporalParameters();
    private PatternDetectionSettings pattern = new PatternDetectionSettings();

    private CacheSettings cache = new CacheSettings();
    private ExecutorSettings executor = new ExecutorSettings();

    @Data
    public static class CacheSettings {
        // "aerospike" or "memory"
        private String type = "aerospike";
    }

    @Data
    public static class ExecutorSettings {
        private int poolSize = 4;
    }

    /**
     * Detached copy of the global toggles and limits. Nested detector defaults are
     * copied too so later edits to either side never leak into the other.
     */
    public AnomalyConfiguration copy() {
        AnomalyConfiguration copy = new AnomalyConfiguration();
        copy.setEnableStatisticalDetection(enableStatisticalDetection);
        copy.setEnableTemporalDetection(enableTemporalDetection);
        copy.setEnablePatternDetection(enablePatternDetection);
        copy.setEnableBusinessRuleDetection(enableBusinessRuleDetection);
        copy.setMinimumConfidenceThreshold(minimumConfidenceThreshold);
        copy.setMaxAnomaliesPerQuery(maxAnomaliesPerQuery);
        copy.setEnableRealTimeAlerts(enableRealTimeAlerts);
        copy.setAlertCooldownPeriod(alertCooldownPeriod);
        copy.setAlertCacheTtl(alertCacheTtl);
        copy.setDetectionTimeout(detectionTimeout);
        copy.setConfigCacheTtl(configCacheTtl);
        copy.setStatistical(statistical.toBuilder().build());
        copy.setTemporal(temporal.toBuilder().build());
        copy.setPattern(pattern.toBuilder().build());
        copy.getCache().setType(cache.getType());
        copy.getExecutor().setPoolSize(executor.getPoolSize());
        return copy;
    }
}
