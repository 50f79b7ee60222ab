package com.bmsedge.analytics.model;

/**
 * Aggregation bucket size with the anomaly policy attached to it.
 */
public enum Granularity {
    DAILY("daily", 30, 0.5),
    WEEKLY("weekly", 4, 0.4),
    MONTHLY("monthly", 3, 0.3);

    private final String value;
    private final int movingAverageWindow;
    private final double deviationThreshold;

    Granularity(String value, int movingAverageWindow, double deviationThreshold) {
        this.value = value;
        this.movingAverageWindow = movingAverageWindow;
        this.deviationThreshold = deviationThreshold;
    }

    public String getValue() {
        return value;
    }

    public int getMovingAverageWindow() {
        return movingAverageWindow;
    }

    /**
     * Allowed deviation as a fraction of the moving average.
     */
    public double getDeviationThreshold() {
        return deviationThreshold;
    }

    /**
     * Unknown or blank values fall back to weekly.
     */
    public static Granularity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return WEEKLY;
        }
        for (Granularity g : values()) {
            if (g.value.equalsIgnoreCase(value.trim()) || g.name().equalsIgnoreCase(value.trim())) {
                return g;
            }
        }
        return WEEKLY;
    }
}
