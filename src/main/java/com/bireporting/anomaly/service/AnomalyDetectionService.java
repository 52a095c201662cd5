package com.bireporting.anomaly.service;

import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.config.MetricsConfig;
import com.bireporting.anomaly.engine.DetectionEngine;
import com.bireporting.anomaly.engine.DetectionOutcome;
import com.bireporting.anomaly.engine.DetectorType;
import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.AnomalyDetectionResult;
import com.bireporting.anomaly.model.AnomalySeverity;
import com.bireporting.anomaly.model.QueryResult;
import com.bireporting.anomaly.model.SemanticAnalysis;
import com.bireporting.anomaly.repository.AnomalyHistoryRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Main orchestrator for query-result anomaly detection.
 *
 * Flow:
 * 1. Run the active detectors concurrently via the DetectionEngine
 * 2. Merge overlapping findings (AnomalyConsolidationService)
 * 3. Escalate severity by business context (SeverityRankingService)
 * 4. Rank by severity, then confidence
 * 5. Raise alerts for HIGH and CRITICAL anomalies (AlertManager)
 * 6. Cut the ranked list to maxAnomaliesPerQuery
 * 7. Derive insights and recommendations from what is returned
 * 8. Record the run for trend analysis
 * 9. Return the result
 *
 * Never throws: any failure after fan-out yields an empty result flagged with error=true.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    static final String ANONYMOUS_USER = "anonymous";

    private final DetectionEngine detectionEngine;
    private final AnomalyConsolidationService consolidationService;
    private final SeverityRankingService rankingService;
    private final InsightService insightService;
    private final AlertManager alertManager;
    private final DetectionConfigurationService configurationService;
    private final AnomalyHistoryRepository historyRepository;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AnomalyDetectionService(DetectionEngine detectionEngine,
                                   AnomalyConsolidationService consolidationService,
                                   SeverityRankingService rankingService,
                                   InsightService insightService,
                                   AlertManager alertManager,
                                   DetectionConfigurationService configurationService,
                                   AnomalyHistoryRepository historyRepository,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.detectionEngine = detectionEngine;
        this.consolidationService = consolidationService;
        this.rankingService = rankingService;
        this.insightService = insightService;
        this.alertManager = alertManager;
        this.configurationService = configurationService;
        this.historyRepository = historyRepository;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Detect anomalies in a query result.
     * This is the main entry point called by the REST controller.
     *
     * @param semanticAnalysis may be null
     * @param userId           may be null; alerts are then keyed to "anonymous"
     */
    @Observed(name = "anomaly.detect", contextualName = "detect-anomalies")
    public AnomalyDetectionResult detectAnomalies(QueryResult queryResult,
                                                  SemanticAnalysis semanticAnalysis,
                                                  String userId) {
        long start = System.nanoTime();
        String user = (userId == null || userId.isBlank()) ? ANONYMOUS_USER : userId;

        if (queryResult == null || queryResult.getColumns() == null || queryResult.getData() == null) {
            return errorResult(user, "Query result with columns and data is required", start);
        }

        try {
            AnomalyConfiguration config = configurationService.getAnomalyConfiguration();
            SemanticAnalysis analysis = semanticAnalysis != null ? semanticAnalysis : SemanticAnalysis.empty();

            // 1. Fan out to the active detectors
            DetectionOutcome outcome = detectionEngine.detectAll(queryResult, analysis, config.getDetectionTimeout());

            // 2-4. Merge, escalate, rank
            List<Anomaly> consolidated = consolidationService.consolidate(outcome.anomalies());
            List<Anomaly> escalated = rankingService.escalate(consolidated);
            List<Anomaly> ranked = rankingService.rank(escalated);

            // 5. Alerts cover everything detected, including anomalies cut below
            if (config.isEnableRealTimeAlerts()) {
                for (Anomaly anomaly : ranked) {
                    if (anomaly.getSeverity().isAtLeast(AnomalySeverity.HIGH)) {
                        alertManager.checkAndSendAlert(anomaly, user, config);
                    }
                }
            }

            // 6. Truncate
            boolean truncated = ranked.size() > config.getMaxAnomaliesPerQuery();
            List<Anomaly> returned = truncated
                    ? new ArrayList<>(ranked.subList(0, config.getMaxAnomaliesPerQuery()))
                    : ranked;

            // 7. Build result
            Instant now = clock.instant();
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("detection_timestamp", now.toString());
            metadata.put("user_id", user);
            metadata.put("query_row_count", queryResult.rowCount());
            metadata.put("query_column_count", queryResult.columnCount());
            metadata.put("detection_methods_used", outcome.invoked().stream().map(DetectorType::getLabel).toList());
            metadata.put("failed_detectors", outcome.failedDetectors());
            metadata.put("total_detected", ranked.size());
            metadata.put("truncated", truncated);
            metadata.put("minimum_confidence_threshold", config.getMinimumConfidenceThreshold());

            AnomalyDetectionResult result = AnomalyDetectionResult.builder()
                    .anomalies(returned)
                    .totalAnomalies(returned.size())
                    .criticalSeverityCount(count(returned, AnomalySeverity.CRITICAL))
                    .highSeverityCount(count(returned, AnomalySeverity.HIGH))
                    .mediumSeverityCount(count(returned, AnomalySeverity.MEDIUM))
                    .lowSeverityCount(count(returned, AnomalySeverity.LOW))
                    .insights(insightService.generateInsights(returned))
                    .recommendations(insightService.generateRecommendations(returned))
                    .detectionMethods(outcome.invoked().size())
                    .processingTime(now)
                    .metadata(metadata)
                    .build();

            // 8. Record history (best effort)
            recordHistory(user, returned, now);

            // 9. Metrics and logging
            for (Anomaly anomaly : returned) {
                metricsConfig.recordAnomalyDetected(anomaly.getType().name());
            }
            metricsConfig.recordDetectionRun(outcome.failedDetectors().isEmpty() ? "success" : "partial",
                    Duration.ofNanos(System.nanoTime() - start));

            if (result.getHighSeverityCount() + result.getCriticalSeverityCount() > 0) {
                log.info("Detected {} anomalies for user={} ({} high, {} critical) in {} rows",
                        result.getTotalAnomalies(), user, result.getHighSeverityCount(),
                        result.getCriticalSeverityCount(), queryResult.rowCount());
            }
            return result;
        } catch (Exception e) {
            log.error("Error in multi-modal anomaly detection for user={}: {}", user, e.getMessage(), e);
            return errorResult(user, e.getMessage(), start);
        }
    }

    private void recordHistory(String user, List<Anomaly> anomalies, Instant detectedAt) {
        try {
            historyRepository.save(user, anomalies, detectedAt);
        } catch (Exception e) {
            log.warn("Failed to record anomaly history for user={}: {}", user, e.getMessage());
        }
    }

    private AnomalyDetectionResult errorResult(String user, String message, long start) {
        metricsConfig.recordDetectionRun("error", Duration.ofNanos(System.nanoTime() - start));

        Instant now = clock.instant();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("error", true);
        metadata.put("error_message", message != null ? message : "Anomaly detection failed");
        metadata.put("detection_timestamp", now.toString());
        metadata.put("user_id", user);

        return AnomalyDetectionResult.builder()
                .processingTime(now)
                .metadata(metadata)
                .build();
    }

    private static int count(List<Anomaly> anomalies, AnomalySeverity severity) {
        return (int) anomalies.stream().filter(a -> a.getSeverity() == severity).count();
    }
}
