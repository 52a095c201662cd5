package com.bireporting.anomaly.engine.detectors;

import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.engine.AnomalyDetector;
import com.bireporting.anomaly.engine.CellValues;
import com.bireporting.anomaly.engine.DetectorType;
import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.AnomalySeverity;
import com.bireporting.anomaly.model.AnomalyType;
import com.bireporting.anomaly.model.ColumnMetadata;
import com.bireporting.anomaly.model.QueryResult;
import com.bireporting.anomaly.model.SemanticAnalysis;
import com.bireporting.anomaly.model.StatisticalThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Flags numeric outliers per column with two independent tests.
 *
 * Z-Score: mean and population standard deviation of the column;
 *   |v - mean| / sd above the threshold is an anomaly (type STATISTICAL).
 *   confidence = min(0.99, z / 5), HIGH if z > 4.
 *
 * IQR: Q1/Q3 by linear interpolation; values outside
 *   [Q1 - k*IQR, Q3 + k*IQR] are anomalies (type OUTLIER).
 *   confidence = min(0.99, distance to nearest fence / (2 * IQR)), HIGH above 0.8.
 *
 * A value can be reported by both tests; merging happens downstream.
 */
@Component
public class StatisticalAnomalyDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalAnomalyDetector.class);

    private static final List<String> NUMERIC_TYPES = List.of(
            "int", "decimal", "float", "double", "money", "numeric", "bigint", "smallint");

    private final AtomicReference<StatisticalThresholds> thresholds;

    public StatisticalAnomalyDetector(AnomalyConfiguration config) {
        this.thresholds = new AtomicReference<>(config.getStatistical().toBuilder().build());
    }

    @Override
    public DetectorType getDetectorType() {
        return DetectorType.STATISTICAL;
    }

    @Override
    public List<Anomaly> detect(QueryResult queryResult, SemanticAnalysis semanticAnalysis) {
        StatisticalThresholds current = thresholds.get();
        List<Anomaly> anomalies = new ArrayList<>();

        List<ColumnMetadata> columns = queryResult.getColumns();
        for (int col = 0; col < columns.size(); col++) {
            ColumnMetadata column = columns.get(col);
            if (!isNumericColumn(column)) continue;

            try {
                anomalies.addAll(detectColumn(queryResult, col, column.getName(), current));
            } catch (Exception e) {
                log.error("Error in statistical detection for column {}: {}",
                        column.getName(), e.getMessage(), e);
                // Keep the anomalies found in the other columns
            }
        }

        log.debug("Statistical detector found {} anomalies", anomalies.size());
        return anomalies;
    }

    @Override
    public void train(List<QueryResult> historicalData) {
        log.debug("Training statistical anomaly detector with {} samples", historicalData.size());
    }

    public void updateThresholds(StatisticalThresholds newThresholds) {
        thresholds.set(newThresholds.toBuilder().build());
        log.info("Updated statistical thresholds: z={}, iqrMultiplier={}, minSample={}",
                newThresholds.getZscoreThreshold(), newThresholds.getIqrMultiplier(),
                newThresholds.getMinimumSampleSize());
    }

    public StatisticalThresholds getThresholds() {
        return thresholds.get().toBuilder().build();
    }

    static boolean isNumericColumn(ColumnMetadata column) {
        String type = column.normalizedType();
        return NUMERIC_TYPES.stream().anyMatch(type::contains);
    }

    private List<Anomaly> detectColumn(QueryResult queryResult, int col, String columnName,
                                       StatisticalThresholds current) {
        List<Integer> rows = new ArrayList<>();
        List<Double> parsed = new ArrayList<>();
        for (int row = 0; row < queryResult.rowCount(); row++) {
            Double value = CellValues.toDouble(queryResult.cell(row, col));
            if (value != null) {
                rows.add(row);
                parsed.add(value);
            }
        }

        if (parsed.size() < current.getMinimumSampleSize() || parsed.isEmpty()) {
            return List.of();
        }

        double[] values = parsed.stream().mapToDouble(Double::doubleValue).toArray();
        List<Anomaly> anomalies = new ArrayList<>();
        anomalies.addAll(detectZScore(values, rows, columnName, current.getZscoreThreshold()));
        anomalies.addAll(detectIqr(values, rows, columnName, current.getIqrMultiplier()));
        return anomalies;
    }

    private List<Anomaly> detectZScore(double[] values, List<Integer> rows, String columnName,
                                       double threshold) {
        List<Anomaly> anomalies = new ArrayList<>();
        double mean = mean(values);
        double stdDev = populationStdDev(values, mean);
        if (stdDev == 0) return anomalies;

        for (int i = 0; i < values.length; i++) {
            double zScore = Math.abs((values[i] - mean) / stdDev);
            if (zScore <= threshold) continue;

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("z_score", zScore);
            metadata.put("mean", mean);
            metadata.put("std_dev", stdDev);

            anomalies.add(Anomaly.builder()
                    .type(AnomalyType.STATISTICAL)
                    .severity(zScore > 4 ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM)
                    .confidence(Math.min(0.99, zScore / 5.0))
                    .description(String.format(Locale.ROOT,
                            "Statistical outlier detected in %s (Z-Score: %.2f)", columnName, zScore))
                    .affectedColumn(columnName)
                    .affectedRows(new ArrayList<>(List.of(rows.get(i))))
                    .expectedValue(mean)
                    .actualValue(values[i])
                    .detectionMethod("Z-Score")
                    .metadata(metadata)
                    .build());
        }
        return anomalies;
    }

    private List<Anomaly> detectIqr(double[] values, List<Integer> rows, String columnName,
                                    double multiplier) {
        List<Anomaly> anomalies = new ArrayList<>();
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double q1 = percentile(sorted, 0.25);
        double q3 = percentile(sorted, 0.75);
        double iqr = q3 - q1;
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;
        String expectedRange = String.format(Locale.ROOT, "[%.2f, %.2f]", lowerBound, upperBound);

        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (value >= lowerBound && value <= upperBound) continue;

            double distance = Math.min(Math.abs(value - lowerBound), Math.abs(value - upperBound));
            // Zero IQR collapses both fences onto Q1; anything outside them gets full confidence
            double confidence = iqr == 0 ? 0.99 : Math.min(0.99, distance / (iqr * 2));

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("q1", q1);
            metadata.put("q3", q3);
            metadata.put("iqr", iqr);
            metadata.put("lower_bound", lowerBound);
            metadata.put("upper_bound", upperBound);

            anomalies.add(Anomaly.builder()
                    .type(AnomalyType.OUTLIER)
                    .severity(confidence > 0.8 ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM)
                    .confidence(confidence)
                    .description("IQR outlier detected in " + columnName)
                    .affectedColumn(columnName)
                    .affectedRows(new ArrayList<>(List.of(rows.get(i))))
                    .expectedValue(expectedRange)
                    .actualValue(value)
                    .detectionMethod("IQR")
                    .metadata(metadata)
                    .build());
        }
        return anomalies;
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    static double populationStdDev(double[] values, double mean) {
        double sumSquares = 0;
        for (double v : values) sumSquares += (v - mean) * (v - mean);
        return Math.sqrt(sumSquares / values.length);
    }

    /**
     * Linear-interpolated percentile over sorted values, index = p * (n - 1).
     */
    static double percentile(double[] sorted, double p) {
        double index = p * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) return sorted[lower];

        double weight = index - lower;
        return sorted[lower] * (1 - weight) + sorted[upper] * weight;
    }
}
