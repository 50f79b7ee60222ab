package com.bmsedge.analytics.model;

public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Severity fromAbsoluteZScore(double absZScore) {
        if (absZScore > 4.0) {
            return CRITICAL;
        } else if (absZScore > 3.5) {
            return HIGH;
        } else if (absZScore > 3.0) {
            return MEDIUM;
        }
        return LOW;
    }
}
