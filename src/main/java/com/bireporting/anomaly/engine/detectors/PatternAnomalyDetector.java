package com.bireporting.anomaly.engine.detectors;

import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.engine.AnomalyDetector;
import com.bireporting.anomaly.engine.DetectorType;
import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.PatternDetectionSettings;
import com.bireporting.anomaly.model.QueryResult;
import com.bireporting.anomaly.model.SemanticAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Placeholder for sequence and frequency pattern analysis. Holds its settings so they
 * can be configured ahead of an implementation; reports no anomalies.
 */
@Component
public class PatternAnomalyDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternAnomalyDetector.class);

    private final AtomicReference<PatternDetectionSettings> settings;

    public PatternAnomalyDetector(AnomalyConfiguration config) {
        this.settings = new AtomicReference<>(config.getPattern().toBuilder().build());
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.PATTERN;
    }

    @Override
    public List<Anomaly> detect(QueryResult queryResult, SemanticAnalysis semanticAnalysis) {
        return new ArrayList<>();
    }

    @Override
    public void train(List<QueryResult> historicalData) {
        log.debug("Training pattern anomaly detector with {} samples", historicalData.size());
    }

    public void updateSettings(PatternDetectionSettings newSettings) {
        settings.set(newSettings.toBuilder().build());
        log.info("Updated pattern settings: similarity={}, minLength={}",
                newSettings.getSimilarityThreshold(), newSettings.getMinimumPatternLength());
    }

    public PatternDetectionSettings getSettings() {
        return settings.get().toBuilder().build();
    }
}
