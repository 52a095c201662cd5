package com.bireporting.anomaly.model;

/**
 * Ordered severity scale. Comparisons go through {@link #getLevel()}, never through the
 * declaration order, so the numeric values are part of the contract.
 */
public enum AnomalySeverity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    AnomalySeverity(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean isAtLeast(AnomalySeverity other) {
        return level >= other.level;
    }

    public static AnomalySeverity max(AnomalySeverity a, AnomalySeverity b) {
        return a.level >= b.level ? a : b;
    }
}
