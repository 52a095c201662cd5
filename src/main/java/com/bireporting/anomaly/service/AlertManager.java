package com.bireporting.anomaly.service;

import com.bireporting.anomaly.cache.CacheService;
import com.bireporting.anomaly.config.AnomalyConfiguration;
import com.bireporting.anomaly.config.MetricsConfig;
import com.bireporting.anomaly.model.Anomaly;
import com.bireporting.anomaly.notification.AlertNotifier;
import com.bireporting.anomaly.notification.AnomalyAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Raises alerts with a per (type, column, user) cooldown.
 *
 * The check and the marker write are not atomic, so two concurrent runs can both alert
 * for the same key. Cache failures propagate to the caller.
 */
@Service
public class AlertManager {

    private static final Logger log = LoggerFactory.getLogger(AlertManager.class);

    static final String KEY_PREFIX = "anomaly_alert:";

    private final CacheService cacheService;
    private final List<AlertNotifier> notifiers;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AlertManager(CacheService cacheService, List<AlertNotifier> notifiers,
                        MetricsConfig metricsConfig, Clock clock) {
        this.cacheService = cacheService;
        this.notifiers = notifiers;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Alert for the anomaly unless an alert with the same key was raised within the
     * cooldown period.
     *
     * @return true if the alert was raised, false if it was suppressed
     */
    public boolean checkAndSendAlert(Anomaly anomaly, String userId, AnomalyConfiguration config) {
        String key = alertKey(anomaly, userId);
        Instant now = clock.instant();

        Optional<Long> lastAlert = cacheService.get(key, Long.class);
        if (lastAlert.isPresent()) {
            Duration since = Duration.between(Instant.ofEpochMilli(lastAlert.get()), now);
            if (since.compareTo(config.getAlertCooldownPeriod()) < 0) {
                log.debug("Alert {} suppressed; last raised {} ago", key, since);
                metricsConfig.recordAlert("suppressed");
                return false;
            }
        }

        AnomalyAlert alert = new AnomalyAlert(anomaly, userId, key, now);
        for (AlertNotifier notifier : notifiers) {
            try {
                notifier.send(alert);
            } catch (RuntimeException e) {
                // A failing channel must not block the others or the cooldown marker
                log.error("Alert notifier {} failed for {}: {}", notifier.getChannel(), key, e.getMessage(), e);
            }
        }

        cacheService.set(key, now.toEpochMilli(), config.getAlertCacheTtl());
        metricsConfig.recordAlert("sent");
        return true;
    }

    static String alertKey(Anomaly anomaly, String userId) {
        return KEY_PREFIX + anomaly.getType() + ":" + anomaly.getAffectedColumn() + ":" + userId;
    }
}
