package com.bireporting.anomaly.service;

import com.bireporting.anomaly.cache.CacheService;
import com.bireporting.anomaly.cache.InMemoryCacheService;
import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.config.MetricsConfig;
import com.bireporting.anomaly.exception.CacheAccessException;
import com.bireporting.anomaly.model.*;
import com.bireporting.anomaly.notification.AlertNotifier;
import com.bireporting.anomaly.notification.AnomalyAlert;
import com.bireporting.anomaly.testutil.MutableClock;
import com.bireporting.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertManagerTest {

    @Mock private AlertNotifier notifier;

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private AlertManager alertManager;
    private AnomalyConfiguration config;

    private final Anomaly revenueAnomaly =
            TestDataFactory.createAnomaly(AnomalyType.STATISTICAL, AnomalySeverity.HIGH, 0.95, "TotalRevenue");

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        registry = new SimpleMeterRegistry();
        config = new AnomalyConfiguration();
        alertManager = new AlertManager(new InMemoryCacheService(clock), List.of(notifier),
                new MetricsConfig(registry), clock);
    }

    @Test
    void firstAlert_isSent() {
        assertThat(alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config)).isTrue();

        ArgumentCaptor<AnomalyAlert> captor = ArgumentCaptor.forClass(AnomalyAlert.class);
        verify(notifier).send(captor.capture());
        assertThat(captor.getValue().alertKey()).isEqualTo("anomaly_alert:STATISTICAL:TotalRevenue:analyst-1");
        assertThat(captor.getValue().userId()).isEqualTo("analyst-1");
        assertThat(captor.getValue().raisedAt()).isEqualTo(clock.instant());
        assertThat(registry.counter("alert.count", "status", "sent").count()).isEqualTo(1.0);
    }

    @Test
    void repeatWithinCooldown_isSuppressed() {
        alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config);
        clock.advance(Duration.ofMinutes(14));

        assertThat(alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config)).isFalse();

        verify(notifier, times(1)).send(any());
        assertThat(registry.counter("alert.count", "status", "suppressed").count()).isEqualTo(1.0);
    }

    @Test
    void repeatAfterCooldown_isSentAgain() {
        alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config);
        clock.advance(Duration.ofMinutes(15));

        assertThat(alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config)).isTrue();
        verify(notifier, times(2)).send(any());
    }

    @Test
    void differentUserOrColumn_hasOwnCooldown() {
        Anomaly depositAnomaly = revenueAnomaly.toBuilder().affectedColumn("DepositAmount").build();

        assertThat(alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config)).isTrue();
        assertThat(alertManager.checkAndSendAlert(revenueAnomaly, "analyst-2", config)).isTrue();
        assertThat(alertManager.checkAndSendAlert(depositAnomaly, "analyst-1", config)).isTrue();
        verify(notifier, times(3)).send(any());
    }

    @Test
    void failingNotifier_doesNotBlockOthersOrCooldown() {
        AlertNotifier broken = mock(AlertNotifier.class);
        when(broken.getChannel()).thenReturn("sms");
        doThrow(new IllegalStateException("gateway down")).when(broken).send(any());
        alertManager = new AlertManager(new InMemoryCacheService(clock), List.of(broken, notifier),
                new MetricsConfig(registry), clock);

        assertThat(alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config)).isTrue();
        verify(notifier).send(any());
        assertThat(alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config)).isFalse();
    }

    @Test
    void cacheFailure_propagates() {
        CacheService failing = mock(CacheService.class);
        when(failing.get(any(), eq(Long.class)))
                .thenThrow(new CacheAccessException("unavailable", new RuntimeException("down")));
        alertManager = new AlertManager(failing, List.of(notifier), new MetricsConfig(registry), clock);

        assertThatThrownBy(() -> alertManager.checkAndSendAlert(revenueAnomaly, "analyst-1", config))
                .isInstanceOf(CacheAccessException.class);
        verifyNoInteractions(notifier);
    }
}
