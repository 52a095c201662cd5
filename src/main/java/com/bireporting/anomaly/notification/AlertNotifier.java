package com.bireporting.anomaly.notification;

/**
 * Delivery channel for anomaly alerts. Implementations handle and log their own delivery
 * failures; the alert is considered raised once the cooldown marker is written.
 */
public interface AlertNotifier {

    /** Channel name used in logs and metrics. */
    String getChannel();

    void send(AnomalyAlert alert);
}
