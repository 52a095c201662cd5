package com.bireporting.anomaly.model;

public enum RecommendationType {
    INVESTIGATION,
    MONITORING,
    ACTION,
    PREVENTION
}
