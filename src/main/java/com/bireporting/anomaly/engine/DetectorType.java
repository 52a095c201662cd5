package com.bireporting.anomaly.engine;

public enum DetectorType {
    STATISTICAL("Statistical"),
    TEMPORAL("Temporal"),
    PATTERN("Pattern"),
    BUSINESS_RULE("BusinessRule");

    private final String label;

    DetectorType(String label) {
        this.label = label;
    }

    /** Name reported under {@code detection_methods_used}. */
    public String getLabel() {
        return label;
    }
}
