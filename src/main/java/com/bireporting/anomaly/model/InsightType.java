package com.bireporting.anomaly.model;

public enum InsightType {
    PATTERN,
    ALERT
}
