package com.bireporting.anomaly.service;

import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.AnomalySeverity;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Assigns business-contextual severity and orders anomalies for presentation.
 *
 * Contextual severity depends only on the affected column and confidence:
 *   column contains "revenue"  -> HIGH
 *   column contains "deposit"  -> MEDIUM
 *   confidence > 0.9           -> HIGH
 *   otherwise                  -> LOW
 * The final severity is the higher of the detector's and the contextual one, so
 * escalation never lowers a severity.
 */
@Service
public class SeverityRankingService {

    private static final Comparator<Anomaly> RANKING =
            Comparator.comparingInt((Anomaly a) -> a.getSeverity().getLevel()).reversed()
                    .thenComparing(Comparator.comparingDouble(Anomaly::getConfidence).reversed());

    public AnomalySeverity contextualSeverity(Anomaly anomaly) {
        String column = anomaly.getAffectedColumn() == null
                ? ""
                : anomaly.getAffectedColumn().toLowerCase(Locale.ROOT);

        if (column.contains("revenue")) {
            return AnomalySeverity.HIGH;
        }
        if (column.contains("deposit")) {
            return AnomalySeverity.MEDIUM;
        }
        return anomaly.getConfidence() > 0.9 ? AnomalySeverity.HIGH : AnomalySeverity.LOW;
    }

    /**
     * @return copies of the anomalies with their final severity; inputs are not modified
     */
    public List<Anomaly> escalate(List<Anomaly> anomalies) {
        List<Anomaly> escalated = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            AnomalySeverity original = anomaly.getSeverity() != null ? anomaly.getSeverity() : AnomalySeverity.LOW;
            AnomalySeverity finalSeverity = AnomalySeverity.max(original, contextualSeverity(anomaly));
            escalated.add(anomaly.toBuilder().severity(finalSeverity).build());
        }
        return escalated;
    }

    /**
     * Severity descending, then confidence descending. Ties keep their input order.
     */
    public List<Anomaly> rank(List<Anomaly> anomalies) {
        List<Anomaly> ranked = new ArrayList<>(anomalies);
        ranked.sort(RANKING);
        return ranked;
    }
}
