package com.bmsedge.analytics.service;

import com.bmsedge.analytics.exception.InvalidParameterException;
import com.bmsedge.analytics.model.WeatherObservation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WeatherDataService
 */
class WeatherDataServiceTest {

    private WeatherCache weatherCache;
    private WeatherDataService weatherDataService;

    @BeforeEach
    void setUp() {
        weatherCache = new WeatherCache();
        weatherDataService = new WeatherDataService(weatherCache);
    }

    @Test
    @DisplayName("Should return one reading per day with seasonal temperatures")
    void testHistoricalWeather() {
        // Act
        List<WeatherObservation> weather = weatherDataService.getHistoricalWeather(
                "130000", LocalDate.of(2024, 7, 14), LocalDate.of(2024, 7, 20));

        // Assert
        assertEquals(7, weather.size());
        WeatherObservation july15 = weather.get(1);
        assertEquals(LocalDate.of(2024, 7, 15), july15.getDate());
        assertEquals(28.0, july15.getTemperature());
        assertEquals(33.0, july15.getMaxTemperature());
        assertEquals(23.0, july15.getMinTemperature());
        assertEquals(75.0, july15.getHumidity());
        assertEquals("Tokyo", july15.getRegionName());
        assertEquals(WeatherDataService.DATA_SOURCE, july15.getDataSource());
    }

    @Test
    @DisplayName("Should serve a repeated range from the cache")
    void testCacheHit() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 31);

        List<WeatherObservation> first = weatherDataService.getHistoricalWeather("270000", start, end);
        List<WeatherObservation> second = weatherDataService.getHistoricalWeather("270000", start, end);

        assertSame(first, second);
        assertEquals(1, weatherCache.size());

        weatherCache.clear();
        List<WeatherObservation> reloaded = weatherDataService.getHistoricalWeather("270000", start, end);
        assertNotSame(first, reloaded);
        assertEquals(first, reloaded);
    }

    @Test
    @DisplayName("Should reject a reversed range")
    void testReversedRange() {
        assertThrows(InvalidParameterException.class, () -> weatherDataService.getHistoricalWeather(
                "130000", LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));
    }

    @Test
    @DisplayName("Should name known regions and flag unknown ones")
    void testRegionNames() {
        assertEquals("Osaka", weatherDataService.getRegionName("270000"));
        assertEquals("Unknown region", weatherDataService.getRegionName("999999"));
        assertEquals(15, weatherDataService.getRegionCodes().size());
        assertEquals(8.0, WeatherDataService.seasonalBase(1));
        assertEquals(18.0, WeatherDataService.seasonalBase(4));
        assertEquals(20.0, WeatherDataService.seasonalBase(10));
    }
}
