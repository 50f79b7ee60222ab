package com.bmsedge.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Pearson correlation between two aligned series, with its significance.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CorrelationResult {

    private final String label;
    private final double coefficient;
    private final double pValue;
    private final int sampleSize;
    private final String interpretation;
    // day shift applied to the second series, 0 for a plain correlation
    private final int lagDays;

    public CorrelationResult(String label, double coefficient, double pValue, int sampleSize,
                             String interpretation, int lagDays) {
        this.label = label;
        this.coefficient = coefficient;
        this.pValue = pValue;
        this.sampleSize = sampleSize;
        this.interpretation = interpretation;
        this.lagDays = lagDays;
    }

    @JsonProperty("pValue")
    public double getPValue() {
        return pValue;
    }

    public double getAbsoluteCoefficient() {
        return Math.abs(coefficient);
    }

    /**
     * @return a copy labelled {@code prefix_label}
     */
    public CorrelationResult withLabelPrefix(String prefix) {
        return new CorrelationResult(prefix + "_" + label, coefficient, pValue, sampleSize, interpretation, lagDays);
    }

    public boolean isLagged() {
        return lagDays != 0;
    }
}
