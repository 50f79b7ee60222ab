package com.bmsedge.analytics.dto;

import lombok.Getter;
import lombok.ToString;

/**
 * Descriptive statistics of one sales series.
 */
@Getter
@ToString
public final class StatisticalSummary {

    private final int count;
    private final double mean;
    // element n/2 of the sorted values
    private final double median;
    private final double stdDev;
    private final double min;
    private final double max;
    private final double total;

    public StatisticalSummary(int count, double mean, double median, double stdDev,
                              double min, double max, double total) {
        this.count = count;
        this.mean = mean;
        this.median = median;
        this.stdDev = stdDev;
        this.min = min;
        this.max = max;
        this.total = total;
    }

    public String describe() {
        return String.format("Statistical summary:%n"
                        + "- Data points: %d%n"
                        + "- Mean sales: %.2f%n"
                        + "- Median: %.2f%n"
                        + "- Standard deviation: %.2f%n"
                        + "- Minimum: %.2f%n"
                        + "- Maximum: %.2f%n"
                        + "- Total sales: %.2f%n",
                count, mean, median, stdDev, min, max, total);
    }
}
