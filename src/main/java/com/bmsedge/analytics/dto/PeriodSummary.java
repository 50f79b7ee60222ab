package com.bmsedge.analytics.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Totals and spread of one day, week or month of sales.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class PeriodSummary {

    // 1-based
    private final int periodIndex;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private final LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private final LocalDate endDate;

    private final double total;
    private final double average;
    private final double min;
    private final double max;
    private final int sampleCount;
    // % change of total against the previous period, 0 when the previous total is not positive
    private final double changePercent;
    private final double stdDev;
    private final double averageTemperature;

    public PeriodSummary(int periodIndex, LocalDate startDate, LocalDate endDate,
                         double total, double average, double min, double max, int sampleCount,
                         double changePercent, double stdDev, double averageTemperature) {
        this.periodIndex = periodIndex;
        this.startDate = startDate;
        this.endDate = endDate;
        this.total = total;
        this.average = average;
        this.min = min;
        this.max = max;
        this.sampleCount = sampleCount;
        this.changePercent = changePercent;
        this.stdDev = stdDev;
        this.averageTemperature = averageTemperature;
    }
}
