package com.bmsedge.analytics.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

@Getter
@EqualsAndHashCode
@ToString
public final class ForecastPoint {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private final LocalDate date;

    private final String dayOfWeek;
    private final double predictedValue;
    // seasonal temperature assumed for the date
    private final double temperature;

    public ForecastPoint(LocalDate date, String dayOfWeek, double predictedValue, double temperature) {
        this.date = date;
        this.dayOfWeek = dayOfWeek;
        this.predictedValue = predictedValue;
        this.temperature = temperature;
    }
}
