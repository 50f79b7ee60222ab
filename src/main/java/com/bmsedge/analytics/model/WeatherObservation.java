package com.bmsedge.analytics.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Daily weather reading for one region.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class WeatherObservation {

    private final LocalDate date;
    private final String regionCode;
    private final String regionName;
    private final double temperature;
    private final double maxTemperature;
    private final double minTemperature;
    private final double humidity;
    private final double windSpeed;
    private final String dataSource;

    public WeatherObservation(LocalDate date, String regionCode, String regionName,
                              double temperature, double maxTemperature, double minTemperature,
                              double humidity, double windSpeed, String dataSource) {
        this.date = date;
        this.regionCode = regionCode;
        this.regionName = regionName;
        this.temperature = temperature;
        this.maxTemperature = maxTemperature;
        this.minTemperature = minTemperature;
        this.humidity = humidity;
        this.windSpeed = windSpeed;
        this.dataSource = dataSource;
    }
}
