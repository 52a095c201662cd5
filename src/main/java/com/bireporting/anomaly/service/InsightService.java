package com.bireporting.anomaly.service;

import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.AnomalyInsight;
import com.bireporting.anomaly.model.AnomalyRecommendation;
import com.bireporting.anomaly.model.AnomalySeverity;
import com.bireporting.anomaly.model.AnomalyType;
import com.bireporting.anomaly.model.InsightType;
import com.bireporting.anomaly.model.RecommendationPriority;
import com.bireporting.anomaly.model.RecommendationType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives insights and recommendations from the final, ranked anomalies.
 */
@Service
public class InsightService {

    static final double ALERT_INSIGHT_CONFIDENCE = 0.95;

    public List<AnomalyInsight> generateInsights(List<Anomaly> anomalies) {
        List<AnomalyInsight> insights = new ArrayList<>();

        for (Map.Entry<AnomalyType, List<Anomaly>> group : groupByType(anomalies).entrySet()) {
            List<Anomaly> members = group.getValue();
            insights.add(AnomalyInsight.builder()
                    .type(InsightType.PATTERN)
                    .title(group.getKey() + " Anomaly Pattern")
                    .description(describe(group.getKey(), members))
                    .confidence(averageConfidence(members))
                    .affectedAnomalies(ids(members))
                    .build());
        }

        List<Anomaly> severe = anomalies.stream()
                .filter(a -> a.getSeverity() != null && a.getSeverity().isAtLeast(AnomalySeverity.HIGH))
                .toList();
        if (!severe.isEmpty()) {
            insights.add(AnomalyInsight.builder()
                    .type(InsightType.ALERT)
                    .title("High Severity Anomalies Detected")
                    .description("Found " + severe.size() + " high-severity anomalies requiring immediate attention")
                    .confidence(ALERT_INSIGHT_CONFIDENCE)
                    .affectedAnomalies(ids(severe))
                    .build());
        }

        return insights;
    }

    public List<AnomalyRecommendation> generateRecommendations(List<Anomaly> anomalies) {
        List<AnomalyRecommendation> recommendations = new ArrayList<>();
        Map<AnomalyType, List<Anomaly>> byType = groupByType(anomalies);

        List<Anomaly> statistical = byType.get(AnomalyType.STATISTICAL);
        if (statistical != null) {
            recommendations.add(AnomalyRecommendation.builder()
                    .type(RecommendationType.INVESTIGATION)
                    .title("Investigate Statistical Outliers")
                    .description("Review data collection processes and validate unusual statistical patterns")
                    .priority(RecommendationPriority.MEDIUM)
                    .estimatedEffort("2-4 hours")
                    .affectedAnomalies(ids(statistical))
                    .build());
        }

        List<Anomaly> temporal = byType.get(AnomalyType.TEMPORAL);
        if (temporal != null) {
            recommendations.add(AnomalyRecommendation.builder()
                    .type(RecommendationType.MONITORING)
                    .title("Monitor Temporal Patterns")
                    .description("Set up alerts for unusual temporal patterns and trends")
                    .priority(RecommendationPriority.HIGH)
                    .estimatedEffort("1-2 hours")
                    .affectedAnomalies(ids(temporal))
                    .build());
        }

        List<Anomaly> violations = byType.get(AnomalyType.BUSINESS_RULE);
        if (violations != null) {
            recommendations.add(AnomalyRecommendation.builder()
                    .type(RecommendationType.ACTION)
                    .title("Review Business Rule Violations")
                    .description("Correct the source records or adjust the rules that flagged them")
                    .priority(RecommendationPriority.HIGH)
                    .estimatedEffort("1-3 hours")
                    .affectedAnomalies(ids(violations))
                    .build());
        }

        return recommendations;
    }

    private static String describe(AnomalyType type, List<Anomaly> members) {
        int count = members.size();
        return switch (type) {
            case STATISTICAL -> String.format(Locale.ROOT,
                    "Detected %d statistical outliers with average confidence %.1f%%",
                    count, averageConfidence(members) * 100);
            case TEMPORAL -> "Found " + count + " temporal anomalies indicating unusual time-based patterns";
            case PATTERN -> "Identified " + count + " pattern anomalies suggesting data irregularities";
            case BUSINESS_RULE -> "Discovered " + count + " business rule violations requiring attention";
            default -> "Detected " + count + " anomalies of type " + type;
        };
    }

    // Groups keep the order in which types first appear in the ranked list
    private static Map<AnomalyType, List<Anomaly>> groupByType(List<Anomaly> anomalies) {
        Map<AnomalyType, List<Anomaly>> groups = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            groups.computeIfAbsent(anomaly.getType(), t -> new ArrayList<>()).add(anomaly);
        }
        return groups;
    }

    private static double averageConfidence(List<Anomaly> anomalies) {
        return anomalies.stream().mapToDouble(Anomaly::getConfidence).average().orElse(0.0);
    }

    private static List<String> ids(List<Anomaly> anomalies) {
        return anomalies.stream().map(Anomaly::getId).toList();
    }
}
