package com.bireporting.anomaly.service;

import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.model.AnomalySeverity;
import com.bireporting.anomaly.model.AnomalyTrendAnalysis;
import com.bireporting.anomaly.model.AnomalyType;
import com.bireporting.anomaly.model.AnomalyTypeFrequency;
import com.bireporting.anomaly.model.TrendDirection;
import com.bireporting.anomaly.repository.AnomalyHistoryRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summarises persisted anomalies over a period.
 *
 * Trend direction compares the last 7 days with the rest of the period:
 *   recent > 1.2 x older -> INCREASING
 *   recent < 0.8 x older -> DECREASING
 *   otherwise, or fewer than 2 anomalies -> STABLE
 */
@Service
public class AnomalyTrendService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyTrendService.class);

    static final Duration RECENT_WINDOW = Duration.ofDays(7);
    static final int HIGH_FREQUENCY_THRESHOLD = 50;
    static final int REVENUE_ANOMALY_THRESHOLD = 5;
    static final int TOP_TYPES = 5;

    private final AnomalyHistoryRepository historyRepository;
    private final Clock clock;

    public AnomalyTrendService(AnomalyHistoryRepository historyRepository, Clock clock) {
        this.historyRepository = historyRepository;
        this.clock = clock;
    }

    /**
     * @param userId restrict to one user's runs, or null for all users
     */
    @Observed(name = "anomaly.trends", contextualName = "anomaly-trends")
    public AnomalyTrendAnalysis getAnomalyTrends(Duration period, String userId) {
        Instant now = clock.instant();
        try {
            List<Anomaly> anomalies = historyRepository.findSince(now.minus(period), userId);
            return analyse(anomalies, period, now);
        } catch (Exception e) {
            log.error("Error generating anomaly trend analysis: {}", e.getMessage(), e);
            return AnomalyTrendAnalysis.builder()
                    .period(period)
                    .generatedAt(now)
                    .build();
        }
    }

    AnomalyTrendAnalysis analyse(List<Anomaly> anomalies, Duration period, Instant now) {
        Map<LocalDate, Integer> byDay = new TreeMap<>();
        Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
        Map<AnomalySeverity, Integer> bySeverity = new EnumMap<>(AnomalySeverity.class);

        for (Anomaly anomaly : anomalies) {
            if (anomaly.getDetectedAt() != null) {
                byDay.merge(LocalDate.ofInstant(anomaly.getDetectedAt(), ZoneOffset.UTC), 1, Integer::sum);
            }
            if (anomaly.getType() != null) {
                byType.merge(anomaly.getType(), 1, Integer::sum);
            }
            if (anomaly.getSeverity() != null) {
                bySeverity.merge(anomaly.getSeverity(), 1, Integer::sum);
            }
        }

        return AnomalyTrendAnalysis.builder()
                .period(period)
                .totalAnomalies(anomalies.size())
                .anomaliesByDay(byDay)
                .anomaliesByType(byType)
                .anomaliesBySeverity(bySeverity)
                .trendDirection(trendDirection(anomalies, now))
                .mostCommonAnomalies(mostCommon(byType, anomalies.size()))
                .recommendedActions(recommendations(anomalies))
                .generatedAt(now)
                .build();
    }

    static TrendDirection trendDirection(List<Anomaly> anomalies, Instant now) {
        if (anomalies.size() < 2) return TrendDirection.STABLE;

        Instant cutoff = now.minus(RECENT_WINDOW);
        long recent = anomalies.stream()
                .filter(a -> a.getDetectedAt() != null && a.getDetectedAt().isAfter(cutoff))
                .count();
        long older = anomalies.size() - recent;

        if (recent > older * 1.2) return TrendDirection.INCREASING;
        if (recent < older * 0.8) return TrendDirection.DECREASING;
        return TrendDirection.STABLE;
    }

    private static List<AnomalyTypeFrequency> mostCommon(Map<AnomalyType, Integer> byType, int total) {
        return byType.entrySet().stream()
                .sorted(Map.Entry.<AnomalyType, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(TOP_TYPES)
                .map(e -> new AnomalyTypeFrequency(e.getKey(), e.getValue(), e.getValue() * 100.0 / total))
                .toList();
    }

    private static List<String> recommendations(List<Anomaly> anomalies) {
        List<String> actions = new ArrayList<>();
        if (anomalies.size() > HIGH_FREQUENCY_THRESHOLD) {
            actions.add("High anomaly frequency detected - consider reviewing data quality processes");
        }

        long revenueAnomalies = anomalies.stream()
                .filter(a -> a.getAffectedColumn() != null
                        && a.getAffectedColumn().toLowerCase(Locale.ROOT).contains("revenue"))
                .count();
        if (revenueAnomalies > REVENUE_ANOMALY_THRESHOLD) {
            actions.add("Multiple revenue anomalies detected - prioritize financial data validation");
        }
        return actions;
    }
}
