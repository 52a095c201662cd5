package com.bireporting.anomaly.model;

public enum RecommendationPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
