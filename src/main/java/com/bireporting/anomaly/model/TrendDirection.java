package com.bireporting.anomaly.model;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE
}
