package com.bmsedge.analytics.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.DayOfWeek;
import java.time.Month;
import java.util.EnumMap;
import java.util.Map;

@Setter
@Getter
public class ProductStatistics {
    private double mean;
    // element n/2 of the sorted history
    private double median;
    private double stdDev;
    private double min;
    private double max;
    private Map<DayOfWeek, Double> weekdayAverage = new EnumMap<>(DayOfWeek.class);
    private Map<Month, Double> monthlyAverage = new EnumMap<>(Month.class);
    // increasing, decreasing or stable
    private String trendDirection;

    public ProductStatistics() {}
}
