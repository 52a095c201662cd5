package com.bireporting.anomaly.service;

import com.bireporting.anomaly.cache.CacheService;
import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.engine.AnomalyDetector;
import com.bireporting.anomaly.engine.DetectionEngine;
import com.bireporting.anomaly.model.AnomalyModelMetadata;
import com.bireporting.anomaly.model.QueryResult;
import com.bireporting.anomaly.model.StatisticalThresholds;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Trains every registered detector on historical results and records when that happened.
 */
@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    public static final String MODEL_METADATA_KEY = "anomaly_model_metadata";
    static final String MODEL_VERSION = "1.0";

    private final DetectionEngine detectionEngine;
    private final DetectionConfigurationService configurationService;
    private final CacheService cacheService;
    private final Clock clock;

    public ModelTrainingService(DetectionEngine detectionEngine,
                                DetectionConfigurationService configurationService,
                                CacheService cacheService, Clock clock) {
        this.detectionEngine = detectionEngine;
        this.configurationService = configurationService;
        this.cacheService = cacheService;
        this.clock = clock;
    }

    /**
     * Train all detectors, including disabled ones, so re-enabling a detector does not
     * require retraining. A detector that fails to train is listed under
     * {@code failed_detectors}; a metadata store failure is logged and the metadata still returned.
     */
    @Observed(name = "model.train", contextualName = "train-detectors")
    public AnomalyModelMetadata trainDetectionModels(List<QueryResult> historicalData, String userId) {
        List<QueryResult> history = historicalData == null ? List.of() : historicalData;
        log.info("Training anomaly detection models with {} historical queries", history.size());

        List<String> failedDetectors = new ArrayList<>();
        for (AnomalyDetector detector : detectionEngine.getRegisteredDetectors()) {
            try {
                detector.train(history);
            } catch (Exception e) {
                log.error("Training failed for detector {}: {}", detector.getDetectorType(), e.getMessage(), e);
                failedDetectors.add(String.valueOf(detector.getDetectorType()));
            }
        }

        AnomalyConfiguration config = configurationService.getAnomalyConfiguration();
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("active_detectors", detectionEngine.getActiveDetectorTypes().stream().map(Enum::name).toList());
        StatisticalThresholds thresholds = configurationService.getDetectionConfiguration().getStatisticalThresholds();
        parameters.put("zscore_threshold", thresholds.getZscoreThreshold());
        parameters.put("iqr_multiplier", thresholds.getIqrMultiplier());
        if (!failedDetectors.isEmpty()) {
            parameters.put("failed_detectors", failedDetectors);
        }

        AnomalyModelMetadata metadata = AnomalyModelMetadata.builder()
                .trainingDataCount(history.size())
                .lastTrainingDate(clock.instant())
                .modelVersion(MODEL_VERSION)
                .userId(userId)
                .modelParameters(parameters)
                .build();

        try {
            cacheService.set(MODEL_METADATA_KEY, metadata, config.getConfigCacheTtl());
        } catch (Exception e) {
            log.error("Failed to store model metadata: {}", e.getMessage(), e);
        }
        log.info("Anomaly detection model training completed");
        return metadata;
    }

    public Optional<AnomalyModelMetadata> getModelMetadata() {
        return cacheService.get(MODEL_METADATA_KEY, AnomalyModelMetadata.class);
    }
}
