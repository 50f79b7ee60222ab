package com.bmsedge.analytics.service;

import com.bmsedge.analytics.exception.InvalidParameterException;
import com.bmsedge.analytics.model.WeatherObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Historical daily weather per region. Readings are generated deterministically from the
 * season and day of month, and every requested range is kept in the injected cache.
 */
@Service
public class WeatherDataService {

    private static final Logger logger = LoggerFactory.getLogger(WeatherDataService.class);

    static final String DATA_SOURCE = "generated";

    private static final Map<String, String> REGION_NAMES = Map.ofEntries(
            Map.entry("130000", "Tokyo"),
            Map.entry("140000", "Kanagawa"),
            Map.entry("120000", "Chiba"),
            Map.entry("110000", "Saitama"),
            Map.entry("270000", "Osaka"),
            Map.entry("280000", "Hyogo"),
            Map.entry("260000", "Kyoto"),
            Map.entry("220000", "Shizuoka"),
            Map.entry("210000", "Gifu"),
            Map.entry("200000", "Nagano"),
            Map.entry("190000", "Yamanashi"),
            Map.entry("080000", "Ibaraki"),
            Map.entry("090000", "Tochigi"),
            Map.entry("100000", "Gunma"),
            Map.entry("240000", "Mie"));

    private final WeatherCache cache;

    public WeatherDataService(WeatherCache cache) {
        this.cache = cache;
    }

    public Map<String, String> getRegionCodes() {
        return REGION_NAMES;
    }

    public String getRegionName(String regionCode) {
        return REGION_NAMES.getOrDefault(regionCode, "Unknown region");
    }

    /**
     * One reading per day from start to end inclusive.
     *
     * @throws InvalidParameterException when start is after end
     */
    public List<WeatherObservation> getHistoricalWeather(String regionCode, LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new InvalidParameterException(String.format("Start date %s is after end date %s", start, end));
        }
        List<WeatherObservation> cached = cache.get(regionCode, start, end);
        if (cached != null) {
            logger.debug("Weather cache hit: region={}, {}..{} ({} days)", regionCode, start, end, cached.size());
            return cached;
        }
        List<WeatherObservation> data = cache.getOrLoad(regionCode, start, end,
                () -> generateRange(regionCode, start, end));
        logger.info("Loaded weather for region {} from {} to {}: {} days", regionCode, start, end, data.size());
        return data;
    }

    private List<WeatherObservation> generateRange(String regionCode, LocalDate start, LocalDate end) {
        String regionName = getRegionName(regionCode);
        int days = (int) ChronoUnit.DAYS.between(start, end) + 1;
        List<WeatherObservation> result = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            LocalDate date = start.plusDays(i);
            double temperature = seasonalBase(date.getMonthValue()) + (date.getDayOfMonth() % 10 - 5);
            result.add(new WeatherObservation(date, regionCode, regionName,
                    temperature, temperature + 5, temperature - 5,
                    60.0 + date.getDayOfMonth() % 20,
                    2.0 + date.getDayOfMonth() % 5,
                    DATA_SOURCE));
        }
        return result;
    }

    static double seasonalBase(int month) {
        if (month >= 6 && month <= 8) {
            return 28.0;
        } else if (month == 12 || month <= 2) {
            return 8.0;
        } else if (month <= 5) {
            return 18.0;
        }
        return 20.0;
    }
}
