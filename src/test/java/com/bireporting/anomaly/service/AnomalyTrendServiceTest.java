package com.bireporting.anomaly.service;

import com.bireporting.anomaly.model.*;
import com.bireporting.anomaly.repository.AnomalyHistoryRepository;
import com.bireporting.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnomalyTrendServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-31T12:00:00Z");
    private static final Duration PERIOD = Duration.ofDays(30);

    @Mock private AnomalyHistoryRepository historyRepository;

    private AnomalyTrendService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyTrendService(historyRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Anomaly at(AnomalyType type, String column, Duration ago) {
        return TestDataFactory.createAnomaly(type, AnomalySeverity.MEDIUM, 0.8, column, 0, "Test", NOW.minus(ago));
    }

    @Test
    void getAnomalyTrends_summarisesHistory() {
        List<Anomaly> history = List.of(
                at(AnomalyType.STATISTICAL, "Amount", Duration.ofDays(1)),
                at(AnomalyType.STATISTICAL, "Amount", Duration.ofDays(2)),
                at(AnomalyType.OUTLIER, "Units", Duration.ofDays(2)),
                at(AnomalyType.BUSINESS_RULE, "Revenue", Duration.ofDays(20)));
        when(historyRepository.findSince(eq(NOW.minus(PERIOD)), eq("analyst-1"))).thenReturn(history);

        AnomalyTrendAnalysis analysis = service.getAnomalyTrends(PERIOD, "analyst-1");

        assertThat(analysis.getTotalAnomalies()).isEqualTo(4);
        assertThat(analysis.getPeriod()).isEqualTo(PERIOD);
        assertThat(analysis.getGeneratedAt()).isEqualTo(NOW);
        assertThat(analysis.getTrendDirection()).isEqualTo(TrendDirection.INCREASING);
        assertThat(analysis.getAnomaliesByType())
                .containsEntry(AnomalyType.STATISTICAL, 2)
                .containsEntry(AnomalyType.OUTLIER, 1)
                .containsEntry(AnomalyType.BUSINESS_RULE, 1);
        assertThat(analysis.getAnomaliesBySeverity()).containsEntry(AnomalySeverity.MEDIUM, 4);
        assertThat(analysis.getAnomaliesByDay())
                .containsEntry(LocalDate.of(2025, 3, 30), 1)
                .containsEntry(LocalDate.of(2025, 3, 29), 2)
                .containsEntry(LocalDate.of(2025, 3, 11), 1);

        AnomalyTypeFrequency top = analysis.getMostCommonAnomalies().get(0);
        assertThat(top.type()).isEqualTo(AnomalyType.STATISTICAL);
        assertThat(top.count()).isEqualTo(2);
        assertThat(top.percentage()).isCloseTo(50.0, within(1e-9));
        assertThat(analysis.getRecommendedActions()).isEmpty();
    }

    @Test
    void trendDirection_decreasingAndStable() {
        List<Anomaly> decreasing = List.of(
                at(AnomalyType.OUTLIER, "A", Duration.ofDays(1)),
                at(AnomalyType.OUTLIER, "A", Duration.ofDays(10)),
                at(AnomalyType.OUTLIER, "A", Duration.ofDays(11)),
                at(AnomalyType.OUTLIER, "A", Duration.ofDays(12)));
        List<Anomaly> balanced = List.of(
                at(AnomalyType.OUTLIER, "A", Duration.ofDays(1)),
                at(AnomalyType.OUTLIER, "A", Duration.ofDays(2)),
                at(AnomalyType.OUTLIER, "A", Duration.ofDays(10)),
                at(AnomalyType.OUTLIER, "A", Duration.ofDays(11)));

        assertThat(AnomalyTrendService.trendDirection(decreasing, NOW)).isEqualTo(TrendDirection.DECREASING);
        assertThat(AnomalyTrendService.trendDirection(balanced, NOW)).isEqualTo(TrendDirection.STABLE);
        assertThat(AnomalyTrendService.trendDirection(decreasing.subList(0, 1), NOW))
                .isEqualTo(TrendDirection.STABLE);
    }

    @Test
    void analyse_recommendsOnHighVolumeAndRevenue() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 45; i++) {
            anomalies.add(at(AnomalyType.OUTLIER, "Units", Duration.ofDays(1)));
        }
        for (int i = 0; i < 6; i++) {
            anomalies.add(at(AnomalyType.STATISTICAL, "TotalRevenue", Duration.ofDays(3)));
        }

        AnomalyTrendAnalysis analysis = service.analyse(anomalies, PERIOD, NOW);

        assertThat(analysis.getRecommendedActions()).containsExactly(
                "High anomaly frequency detected - consider reviewing data quality processes",
                "Multiple revenue anomalies detected - prioritize financial data validation");
    }

    @Test
    void getAnomalyTrends_repositoryFailure_returnsEmptyAnalysis() {
        when(historyRepository.findSince(any(), any())).thenThrow(new RuntimeException("aerospike down"));

        AnomalyTrendAnalysis analysis = service.getAnomalyTrends(PERIOD, null);

        assertThat(analysis.getTotalAnomalies()).isZero();
        assertThat(analysis.getPeriod()).isEqualTo(PERIOD);
        assertThat(analysis.getTrendDirection()).isEqualTo(TrendDirection.STABLE);
    }
}
