package com.bireporting.anomaly.engine;

import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.QueryResult;
import com.bireporting.anomaly.model.SemanticAnalysis;

import java.util.List;

/**
 * Interface for all anomaly detectors.
 * Each implementation handles one {@link DetectorType} and is registered with the
 * {@link DetectionEngine} automatically.
 */
public interface AnomalyDetector {

    /**
     * The detector type this implementation handles.
     */
    DetectorType getDetectorType();

    /**
     * Scan a query result for anomalies.
     *
     * Implementations are called concurrently with the other detectors and must not
     * mutate the inputs. They should contain their own failures (log and return what
     * they have); anything that still escapes is treated by the engine as an empty
     * contribution.
     *
     * @param queryResult      the rows and columns to scan
     * @param semanticAnalysis analysis of the originating question, never null
     * @return anomalies found, possibly empty
     */
    List<Anomaly> detect(QueryResult queryResult, SemanticAnalysis semanticAnalysis);

    /**
     * Let the detector learn from historical results.
     */
    void train(List<QueryResult> historicalData);
}
