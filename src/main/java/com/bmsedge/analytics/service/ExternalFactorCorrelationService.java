package com.bmsedge.analytics.service;

import com.bmsedge.analytics.config.AnalyticsProperties;
import com.bmsedge.analytics.dto.CorrelationResult;
import com.bmsedge.analytics.exception.ErrorKind;
import com.bmsedge.analytics.exception.InsufficientDataException;
import com.bmsedge.analytics.exception.StatisticsException;
import com.bmsedge.analytics.model.ObservationSeries;
import com.bmsedge.analytics.model.WeatherObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Lagged correlation of a product's sales against weather and economic indicators.
 * Each factor is scanned independently; a factor that fails is logged and skipped.
 */
@Service
public class ExternalFactorCorrelationService {

    private static final Logger logger = LoggerFactory.getLogger(ExternalFactorCorrelationService.class);

    static final double MIN_NOTABLE_COEFFICIENT = 0.3;

    @Autowired
    private CorrelationService correlationService;

    @Autowired
    private WeatherDataService weatherDataService;

    @Autowired
    private EconomicDataService economicDataService;

    @Autowired
    private AnalyticsProperties properties;

    /**
     * @return at most three results labelled {@code temperature_<lag>} or {@code humidity_<lag>}
     */
    public List<CorrelationResult> analyzeSalesWeatherCorrelation(ObservationSeries sales, String regionCode) {
        requireSales(sales);
        String region = regionCode == null || regionCode.isBlank()
                ? properties.getWeather().getDefaultRegion() : regionCode;

        List<WeatherObservation> weather = weatherDataService.getHistoricalWeather(
                region, sales.firstDate(), sales.lastDate());
        if (weather.isEmpty()) {
            logger.warn("No weather data for region {}", region);
            return new ArrayList<>();
        }
        if (sales.size() < CorrelationService.MIN_ALIGNED_POINTS) {
            throw new InsufficientDataException(String.format(
                    "Weather correlation needs at least %d sales points, got %d",
                    CorrelationService.MIN_ALIGNED_POINTS, sales.size()), ErrorKind.INSUFFICIENT_SAMPLES);
        }

        int maxLag = properties.getWeather().getMaxLagDays();
        List<CorrelationResult> notable = new ArrayList<>();
        notable.addAll(scanFactor("temperature", sales, weather, WeatherObservation::getTemperature, maxLag));
        notable.addAll(scanFactor("humidity", sales, weather, WeatherObservation::getHumidity, maxLag));
        return CorrelationService.topByMagnitude(notable, CorrelationService.TOP_RESULTS);
    }

    private List<CorrelationResult> scanFactor(String factor, ObservationSeries sales, List<WeatherObservation> weather,
                                               ToDoubleFunction<WeatherObservation> field, int maxLag) {
        List<LocalDate> dates = new ArrayList<>(weather.size());
        double[] values = new double[weather.size()];
        for (int i = 0; i < weather.size(); i++) {
            dates.add(weather.get(i).getDate());
            values[i] = field.applyAsDouble(weather.get(i));
        }
        try {
            List<CorrelationResult> lagged = correlationService.laggedCorrelation(
                    sales.dates(), sales.values(), dates, values, maxLag);
            List<CorrelationResult> kept = keepNotable(lagged, factor);
            logger.info("{} lag scan finished: {} lags, {} notable", factor, lagged.size(), kept.size());
            return kept;
        } catch (StatisticsException e) {
            logger.warn("Skipping {} correlation: {}", factor, e.getMessage());
            return new ArrayList<>();
        }
    }

    /**
     * Scans each symbol over the date range of the sales. Empty symbols fall back to the configured
     * list and a max lag of 0 to the configured default.
     *
     * @return at most three results labelled {@code <SYMBOL>_<lag>}
     */
    public List<CorrelationResult> analyzeSalesEconomicCorrelation(ObservationSeries sales, List<String> symbols,
                                                                   int maxLagDays) {
        requireSales(sales);
        List<String> effectiveSymbols = symbols == null || symbols.isEmpty()
                ? properties.getEconomic().getSymbols() : symbols;
        int maxLag = maxLagDays == 0 ? properties.getEconomic().getMaxLagDays() : maxLagDays;

        List<CorrelationResult> notable = new ArrayList<>();
        int skipped = 0;
        for (String symbol : effectiveSymbols) {
            try {
                ObservationSeries market = economicDataService.getMarketSeries(
                        symbol, sales.firstDate(), sales.lastDate());
                if (market.isEmpty()) {
                    logger.warn("Economic series for {} is empty", symbol);
                    skipped++;
                    continue;
                }
                List<CorrelationResult> lagged = correlationService.laggedCorrelation(sales, market, maxLag);
                List<CorrelationResult> kept = keepNotable(lagged, symbol);
                notable.addAll(kept);
                logger.info("{} lag scan finished: {} lags, {} notable", symbol, lagged.size(), kept.size());
            } catch (StatisticsException e) {
                logger.warn("Skipping economic symbol {}: {}", symbol, e.getMessage());
                skipped++;
            }
        }
        if (skipped > 0) {
            logger.info("Economic correlation skipped {} of {} symbols", skipped, effectiveSymbols.size());
        }
        return CorrelationService.topByMagnitude(notable, CorrelationService.TOP_RESULTS);
    }

    private static List<CorrelationResult> keepNotable(List<CorrelationResult> results, String prefix) {
        List<CorrelationResult> kept = new ArrayList<>();
        for (CorrelationResult r : results) {
            if (r.getPValue() < CorrelationService.SIGNIFICANCE_LEVEL
                    || r.getAbsoluteCoefficient() >= MIN_NOTABLE_COEFFICIENT) {
                kept.add(r.withLabelPrefix(prefix));
            }
        }
        return kept;
    }

    private static void requireSales(ObservationSeries sales) {
        if (sales == null || sales.isEmpty()) {
            throw new InsufficientDataException("Sales series is empty");
        }
    }
}
