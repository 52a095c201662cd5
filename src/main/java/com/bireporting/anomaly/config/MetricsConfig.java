package com.bireporting.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetectionRun(String status, Duration elapsed) {
        Counter.builder("detection.run.count")
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("detection.run.duration")
                .tag("status", status)
                .register(registry)
                .record(elapsed);
    }

    public void recordAnomalyDetected(String anomalyType) {
        Counter.builder("detection.anomalies.count")
                .tag("type", anomalyType)
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String detector, String reason) {
        Counter.builder("detector.failure.count")
                .tag("detector", detector)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAlert(String status) {
        Counter.builder("alert.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
