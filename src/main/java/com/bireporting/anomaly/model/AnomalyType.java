package com.bireporting.anomaly.model;

public enum AnomalyType {
    STATISTICAL,
    TEMPORAL,
    PATTERN,
    BUSINESS_RULE,
    OUTLIER,
    TREND,
    SEASONAL
}
