package com.bmsedge.analytics.model;

public enum AnomalyDirection {
    INCREASE("increase"),
    DECREASE("decrease");

    private final String label;

    AnomalyDirection(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
