package com.bireporting.anomaly.notification;

import com.bireporting.anomaly.config.MetricsConfig;
import com.bireporting.anomaly.config.TwilioNotificationConfig;
import com.bireporting.anomaly.model.*;
import com.bireporting.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class AlertNotifierTest {

    private SimpleMeterRegistry registry;
    private MetricsConfig metricsConfig;
    private AnomalyAlert alert;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(registry);
        Anomaly anomaly = TestDataFactory.createAnomaly(AnomalyType.STATISTICAL, AnomalySeverity.HIGH, 0.934,
                "TotalRevenue");
        alert = new AnomalyAlert(anomaly, "analyst-1", "anomaly_alert:STATISTICAL:TotalRevenue:analyst-1",
                Instant.parse("2025-03-01T10:00:00Z"));
    }

    @Test
    void loggingNotifier_recordsDelivery() {
        LoggingAlertNotifier notifier = new LoggingAlertNotifier(metricsConfig);

        notifier.send(alert);

        assertThat(notifier.getChannel()).isEqualTo("log");
        assertThat(registry.counter("notification.sent.count", "channel", "log", "status", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void twilioNotifier_disabled_sendsNothing() {
        TwilioNotificationConfig config = new TwilioNotificationConfig();
        TwilioAlertNotifier notifier = new TwilioAlertNotifier(config, metricsConfig);
        notifier.init();

        notifier.send(alert);

        assertThat(registry.find("notification.sent.count").counters()).isEmpty();
        assertThat(notifier.getChannel()).isEqualTo("sms");
    }

    @Test
    void twilioNotifier_messageBody() {
        TwilioAlertNotifier notifier = new TwilioAlertNotifier(new TwilioNotificationConfig(), metricsConfig);

        String body = notifier.buildMessageBody(alert);

        assertThat(body).startsWith("[ANOMALY ALERT] HIGH STATISTICAL anomaly");
        assertThat(body).contains("Column: TotalRevenue");
        assertThat(body).contains("Confidence: 0.93");
        assertThat(body).contains("User: analyst-1");
        assertThat(body).contains("Details: Test anomaly in TotalRevenue");
    }
}
