package com.bireporting.anomaly.notification;

import com.bireporting.anomaly.config.MetricsConfig;
import com.bireporting.anomaly.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertNotifier.class);

    private final MetricsConfig metricsConfig;

    public LoggingAlertNotifier(MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
    }

    @Override
    public String getChannel() {
        return "log";
    }

    @Override
    public void send(AnomalyAlert alert) {
        Anomaly anomaly = alert.anomaly();
        log.warn("ANOMALY ALERT: {} {} anomaly detected in {} - {} (user={})",
                anomaly.getSeverity(), anomaly.getType(), anomaly.getAffectedColumn(),
                anomaly.getDescription(), alert.userId());
        metricsConfig.recordNotification(getChannel(), "success");
    }
}
