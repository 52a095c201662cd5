package com.bireporting.anomaly.notification;

import com.bireporting.anomaly.model.Anomaly;

import java.time.Instant;

/**
 * One alert that passed the cooldown check.
 *
 * @param alertKey cooldown key the alert was recorded under
 */
public record AnomalyAlert(Anomaly anomaly, String userId, String alertKey, Instant raisedAt) {}
