package com.bmsedge.analytics.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Strongest lag found inside one sliding window.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class WindowedLagResult {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private final LocalDate windowStart;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private final LocalDate windowEnd;

    private final int bestLag;
    private final double coefficient;
    private final double pValue;
    // Benjamini-Hochberg adjusted over every lag evaluated in the window
    private final double adjustedPValue;
    private final int sampleSize;

    public WindowedLagResult(LocalDate windowStart, LocalDate windowEnd, int bestLag, double coefficient,
                             double pValue, double adjustedPValue, int sampleSize) {
        this.windowStart = windowStart;
        this.windowEnd = windowEnd;
        this.bestLag = bestLag;
        this.coefficient = coefficient;
        this.pValue = pValue;
        this.adjustedPValue = adjustedPValue;
        this.sampleSize = sampleSize;
    }

    @JsonProperty("pValue")
    public double getPValue() {
        return pValue;
    }
}
