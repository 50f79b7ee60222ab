package com.bmsedge.analytics.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Daily sales of one product, optionally joined with the temperature of that day.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SalesDataPoint {

    private final LocalDate date;
    private final double sales;
    // null when no weather was matched to this day
    private final Double temperature;

    public SalesDataPoint(LocalDate date, double sales) {
        this(date, sales, null);
    }

    public SalesDataPoint(LocalDate date, double sales, Double temperature) {
        this.date = Objects.requireNonNull(date, "date");
        this.sales = sales;
        this.temperature = temperature;
    }

    public DayOfWeek getDayOfWeek() {
        return date.getDayOfWeek();
    }

    public boolean hasTemperature() {
        return temperature != null && temperature > 0;
    }

    public double temperatureOrZero() {
        return temperature != null ? temperature : 0;
    }
}
