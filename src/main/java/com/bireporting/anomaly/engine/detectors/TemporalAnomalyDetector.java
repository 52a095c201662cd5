package com.bireporting.anomaly.engine.detectors;

import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.engine.AnomalyDetector;
import com.bireporting.anomaly.engine.DetectorType;
import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.ColumnMetadata;
import com.bireporting.anomaly.model.QueryResult;
import com.bireporting.anomaly.model.SemanticAnalysis;
import com.bireporting.anomaly.model.TemporalParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Locates date/time columns in a result. Time-series analysis over them is not
 * implemented, so no anomalies are reported yet.
 */
@Component
public class TemporalAnomalyDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(TemporalAnomalyDetector.class);

    private static final List<String> TEMPORAL_TYPES = List.of("datetime", "date", "time", "timestamp");

    private final AtomicReference<TemporalParameters> parameters;

    public TemporalAnomalyDetector(AnomalyConfiguration config) {
        this.parameters = new AtomicReference<>(config.getTemporal().toBuilder().build());
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.TEMPORAL;
    }

    @Override
    public List<Anomaly> detect(QueryResult queryResult, SemanticAnalysis semanticAnalysis) {
        List<String> temporalColumns = findTemporalColumns(queryResult.getColumns());
        if (!temporalColumns.isEmpty()) {
            log.debug("Temporal columns found: {} (seasonality period {})",
                    temporalColumns, parameters.get().getSeasonalityPeriod());
        }
        return new ArrayList<>();
    }

    @Override
    public void train(List<QueryResult> historicalData) {
        log.debug("Training temporal anomaly detector with {} samples", historicalData.size());
    }

    public void updateParameters(TemporalParameters newParameters) {
        parameters.set(newParameters.toBuilder().build());
        log.info("Updated temporal parameters: seasonality={}, trendThreshold={}, window={}",
                newParameters.getSeasonalityPeriod(), newParameters.getTrendThreshold(),
                newParameters.getMovingAverageWindow());
    }

    public TemporalParameters getParameters() {
        return parameters.get().toBuilder().build();
    }

    static List<String> findTemporalColumns(List<ColumnMetadata> columns) {
        List<String> names = new ArrayList<>();
        if (columns == null) return names;

        for (ColumnMetadata column : columns) {
            String type = column.normalizedType();
            if (TEMPORAL_TYPES.stream().anyMatch(type::contains)) {
                names.add(column.getName());
            }
        }
        return names;
    }
}
