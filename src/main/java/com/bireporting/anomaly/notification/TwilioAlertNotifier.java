package com.bireporting.anomaly.notification;

import com.bireporting.anomaly.config.MetricsConfig;
import com.bireporting.anomaly.config.TwilioNotificationConfig;
import com.bireporting.anomaly.model.Anomaly;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class TwilioAlertNotifier implements AlertNotifier {

    private static final Logger log = LoggerFactory.getLogger(TwilioAlertNotifier.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;

    public TwilioAlertNotifier(TwilioNotificationConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio alert notifier initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio alert notifier is DISABLED.");
        }
    }

    @Override
    public String getChannel() {
        return config.getChannel();
    }

    @Async
    @Override
    @Observed(name = "notification.send", contextualName = "send-alert-notification")
    public void send(AnomalyAlert alert) {
        if (!config.isEnabled()) {
            return;
        }

        try {
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    buildMessageBody(alert)
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Twilio alert sent for key={}, sid={}", alert.alertKey(), message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send Twilio alert for key={}: {}", alert.alertKey(), e.getMessage(), e);
        }
    }

    String buildMessageBody(AnomalyAlert alert) {
        Anomaly anomaly = alert.anomaly();
        return String.format(Locale.ROOT,
                "[ANOMALY ALERT] %s %s anomaly\n" +
                "Column: %s\n" +
                "Confidence: %.2f\n" +
                "User: %s\n" +
                "Details: %s",
                anomaly.getSeverity(),
                anomaly.getType(),
                anomaly.getAffectedColumn() == null ? "N/A" : anomaly.getAffectedColumn(),
                anomaly.getConfidence(),
                alert.userId(),
                anomaly.getDescription()
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
