package com.bmsedge.analytics.dto;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public final class ConfidenceInterval {

    private final double lower;
    private final double upper;
    // e.g. 0.95
    private final double confidence;

    public ConfidenceInterval(double lower, double upper, double confidence) {
        this.lower = lower;
        this.upper = upper;
        this.confidence = confidence;
    }
}
