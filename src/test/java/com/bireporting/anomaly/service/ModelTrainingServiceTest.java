package com.bireporting.anomaly.service;

import com.bireporting.anomaly.cache.CacheService;
import com.bireporting.anomaly.cache.InMemoryCacheService;
import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.engine.AnomalyDetector;
import com.bireporting.anomaly.engine.DetectionEngine;
import com.bireporting.anomaly.engine.DetectorType;
import com.bireporting.anomaly.exception.CacheAccessException;
import com.bireporting.anomaly.model.*;
import com.bireporting.anomaly.testutil.MutableClock;
import com.bireporting.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelTrainingServiceTest {

    @Mock private DetectionEngine detectionEngine;
    @Mock private DetectionConfigurationService configurationService;
    @Mock private AnomalyDetector statistical;
    @Mock private AnomalyDetector temporal;

    private MutableClock clock;
    private ModelTrainingService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        service = new ModelTrainingService(detectionEngine, configurationService,
                new InMemoryCacheService(clock), clock);
    }

    @Test
    void trainDetectionModels_trainsEveryDetectorAndStoresMetadata() {
        List<QueryResult> history = List.of(
                TestDataFactory.numericColumn("Amount", 1, 2),
                TestDataFactory.numericColumn("Amount", 3, 4));
        when(detectionEngine.getRegisteredDetectors()).thenReturn(List.of(statistical, temporal));
        when(detectionEngine.getActiveDetectorTypes()).thenReturn(List.of(DetectorType.STATISTICAL));
        when(configurationService.getAnomalyConfiguration()).thenReturn(new AnomalyConfiguration());
        when(configurationService.getDetectionConfiguration()).thenReturn(AnomalyDetectionConfiguration.builder()
                .statisticalThresholds(StatisticalThresholds.builder().zscoreThreshold(2.5).build())
                .build());

        AnomalyModelMetadata metadata = service.trainDetectionModels(history, "analyst-1");

        verify(statistical).train(history);
        verify(temporal).train(history);
        assertThat(metadata.getTrainingDataCount()).isEqualTo(2);
        assertThat(metadata.getModelVersion()).isEqualTo("1.0");
        assertThat(metadata.getUserId()).isEqualTo("analyst-1");
        assertThat(metadata.getLastTrainingDate()).isEqualTo(clock.instant());
        assertThat(metadata.getModelParameters())
                .containsEntry("active_detectors", List.of("STATISTICAL"))
                .containsEntry("zscore_threshold", 2.5)
                .containsEntry("iqr_multiplier", 1.5);

        AnomalyModelMetadata stored = service.getModelMetadata().orElseThrow();
        assertThat(stored.getTrainingDataCount()).isEqualTo(2);
        assertThat(stored.getLastTrainingDate()).isEqualTo(clock.instant());
    }

    @Test
    void trainDetectionModels_failingDetector_doesNotStopTheOthers() {
        List<QueryResult> history = List.of(TestDataFactory.numericColumn("Amount", 1, 2));
        stubConfiguration();
        when(detectionEngine.getRegisteredDetectors()).thenReturn(List.of(statistical, temporal));
        when(statistical.getDetectorType()).thenReturn(DetectorType.STATISTICAL);
        doThrow(new IllegalStateException("bad history")).when(statistical).train(history);

        AnomalyModelMetadata metadata = service.trainDetectionModels(history, "analyst-1");

        verify(temporal).train(history);
        assertThat(metadata.getModelParameters()).containsEntry("failed_detectors", List.of("STATISTICAL"));
        assertThat(service.getModelMetadata()).isPresent();
    }

    @Test
    void trainDetectionModels_nullHistory_trainsOnNothing() {
        stubConfiguration();
        when(detectionEngine.getRegisteredDetectors()).thenReturn(List.of(statistical));

        AnomalyModelMetadata metadata = service.trainDetectionModels(null, "analyst-1");

        verify(statistical).train(List.of());
        assertThat(metadata.getTrainingDataCount()).isZero();
    }

    @Test
    void trainDetectionModels_metadataStoreFailure_stillReturnsMetadata() {
        CacheService failingCache = mock(CacheService.class);
        doThrow(new CacheAccessException("store down", new RuntimeException()))
                .when(failingCache).set(anyString(), any(), any());
        service = new ModelTrainingService(detectionEngine, configurationService, failingCache, clock);
        stubConfiguration();
        when(detectionEngine.getRegisteredDetectors()).thenReturn(List.of());

        AnomalyModelMetadata metadata = service.trainDetectionModels(List.of(), "analyst-1");

        assertThat(metadata.getModelVersion()).isEqualTo("1.0");
    }

    private void stubConfiguration() {
        when(detectionEngine.getActiveDetectorTypes()).thenReturn(List.of());
        when(configurationService.getAnomalyConfiguration()).thenReturn(new AnomalyConfiguration());
        when(configurationService.getDetectionConfiguration()).thenReturn(AnomalyDetectionConfiguration.builder()
                .statisticalThresholds(new StatisticalThresholds())
                .build());
    }

    @Test
    void getModelMetadata_neverTrained_isEmpty() {
        assertThat(service.getModelMetadata()).isEmpty();
    }

    @Test
    void getModelMetadata_expiresWithConfigTtl() {
        when(detectionEngine.getRegisteredDetectors()).thenReturn(List.of());
        when(detectionEngine.getActiveDetectorTypes()).thenReturn(List.of());
        when(configurationService.getAnomalyConfiguration()).thenReturn(new AnomalyConfiguration());
        when(configurationService.getDetectionConfiguration()).thenReturn(AnomalyDetectionConfiguration.builder()
                .statisticalThresholds(new StatisticalThresholds())
                .build());
        service.trainDetectionModels(List.of(), "analyst-1");

        clock.advance(Duration.ofDays(30));

        assertThat(service.getModelMetadata()).isEmpty();
    }
}
