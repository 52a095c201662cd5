package com.bireporting.anomaly.service;

import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.AnomalySeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges overlapping findings from different detectors into single anomalies.
 *
 * Anomalies are visited in descending confidence. Each unvisited anomaly collects every
 * unvisited anomaly of the same type and column whose confidence is within
 * {@link #CONFIDENCE_TOLERANCE} of its own; a group of two or more becomes one merged
 * anomaly, a group of one passes through unchanged. Every input ends up in exactly one
 * output.
 */
@Service
public class AnomalyConsolidationService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyConsolidationService.class);

    static final double CONFIDENCE_TOLERANCE = 0.2;

    public List<Anomaly> consolidate(List<Anomaly> anomalies) {
        List<Anomaly> ordered = new ArrayList<>(anomalies);
        ordered.sort(Comparator.comparingDouble(Anomaly::getConfidence).reversed());

        // Identity, not id: anomalies from external detectors may reuse ids
        Set<Anomaly> processed = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Anomaly> consolidated = new ArrayList<>();

        for (Anomaly anomaly : ordered) {
            if (processed.contains(anomaly)) continue;

            List<Anomaly> group = new ArrayList<>();
            for (Anomaly candidate : ordered) {
                if (!processed.contains(candidate) && isSimilar(anomaly, candidate)) {
                    group.add(candidate);
                }
            }
            processed.addAll(group);

            consolidated.add(group.size() > 1 ? merge(group) : anomaly);
        }

        if (consolidated.size() < anomalies.size()) {
            log.debug("Consolidated {} anomalies into {}", anomalies.size(), consolidated.size());
        }
        return consolidated;
    }

    private static boolean isSimilar(Anomaly primary, Anomaly candidate) {
        return candidate.getType() == primary.getType()
                && Objects.equals(candidate.getAffectedColumn(), primary.getAffectedColumn())
                && Math.abs(candidate.getConfidence() - primary.getConfidence()) < CONFIDENCE_TOLERANCE;
    }

    /**
     * Group is in descending confidence; the first element supplies the type, column and values.
     */
    Anomaly merge(List<Anomaly> group) {
        Anomaly primary = group.get(0);

        AnomalySeverity severity = primary.getSeverity();
        double confidenceSum = 0;
        Set<Integer> rows = new LinkedHashSet<>();
        Set<String> methods = new LinkedHashSet<>();
        Instant earliest = primary.getDetectedAt();
        List<String> sourceIds = new ArrayList<>();

        for (Anomaly anomaly : group) {
            if (anomaly.getSeverity() != null) {
                severity = severity == null ? anomaly.getSeverity() : AnomalySeverity.max(severity, anomaly.getSeverity());
            }
            confidenceSum += anomaly.getConfidence();
            if (anomaly.getAffectedRows() != null) {
                rows.addAll(anomaly.getAffectedRows());
            }
            if (anomaly.getDetectionMethod() != null) {
                methods.add(anomaly.getDetectionMethod());
            }
            if (anomaly.getDetectedAt() != null && (earliest == null || anomaly.getDetectedAt().isBefore(earliest))) {
                earliest = anomaly.getDetectedAt();
            }
            sourceIds.add(anomaly.getId());
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("merged_anomaly_count", group.size());
        metadata.put("source_anomaly_ids", sourceIds);

        return Anomaly.builder()
                .type(primary.getType())
                .severity(severity)
                .confidence(confidenceSum / group.size())
                .description("Multiple " + primary.getType() + " anomalies detected")
                .affectedColumn(primary.getAffectedColumn())
                .affectedRows(new ArrayList<>(rows))
                .expectedValue(primary.getExpectedValue())
                .actualValue(primary.getActualValue())
                .detectionMethod(String.join(", ", methods))
                .detectedAt(earliest != null ? earliest : Instant.now())
                .metadata(metadata)
                .build();
    }
}
