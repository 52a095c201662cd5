package com.bireporting.anomaly.testutil;

import com.bireporting.anomaly.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    private TestDataFactory() {}

    public static ColumnMetadata column(String name, String dataType) {
        return ColumnMetadata.builder().name(name).dataType(dataType).build();
    }

    public static QueryResult queryResult(List<ColumnMetadata> columns, List<List<Object>> rows) {
        return QueryResult.builder()
                .columns(new ArrayList<>(columns))
                .data(new ArrayList<>(rows))
                .build();
    }

    /** Single numeric column, one row per value. */
    public static QueryResult numericColumn(String name, double... values) {
        List<List<Object>> rows = new ArrayList<>();
        for (double value : values) {
            rows.add(new ArrayList<>(List.of(value)));
        }
        return queryResult(List.of(column(name, "decimal(18,2)")), rows);
    }

    public static List<Object> row(Object... cells) {
        return new ArrayList<>(Arrays.asList(cells));
    }

    public static Anomaly createAnomaly(AnomalyType type, AnomalySeverity severity,
                                        double confidence, String column) {
        return Anomaly.builder()
                .type(type)
                .severity(severity)
                .confidence(confidence)
                .description("Test anomaly in " + column)
                .affectedColumn(column)
                .affectedRows(new ArrayList<>(List.of(0)))
                .detectionMethod("Test")
                .build();
    }

    public static Anomaly createAnomaly(AnomalyType type, AnomalySeverity severity, double confidence,
                                        String column, int row, String method, Instant detectedAt) {
        return Anomaly.builder()
                .type(type)
                .severity(severity)
                .confidence(confidence)
                .description("Test anomaly in " + column)
                .affectedColumn(column)
                .affectedRows(new ArrayList<>(List.of(row)))
                .detectionMethod(method)
                .detectedAt(detectedAt)
                .build();
    }

    public static BusinessRule createRule(String id, String name, String condition, AnomalySeverity severity) {
        return BusinessRule.builder()
                .id(id)
                .name(name)
                .description("Test rule: " + name)
                .condition(condition)
                .severity(severity)
                .build();
    }
}
