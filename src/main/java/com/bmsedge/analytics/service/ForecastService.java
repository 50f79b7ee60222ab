package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.ConfidenceInterval;
import com.bmsedge.analytics.dto.ForecastPoint;
import com.bmsedge.analytics.dto.ProductForecast;
import com.bmsedge.analytics.dto.ProductStatistics;
import com.bmsedge.analytics.dto.RegressionModel;
import com.bmsedge.analytics.exception.InsufficientDataException;
import com.bmsedge.analytics.exception.StatisticsException;
import com.bmsedge.analytics.model.ForecastHorizon;
import com.bmsedge.analytics.model.SalesDataPoint;
import com.bmsedge.analytics.util.StatisticsMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.*;

/**
 * Short-horizon demand forecast from the mean, weekday effect, seasonal temperature and linear trend.
 */
@Service
public class ForecastService {

    private static final Logger logger = LoggerFactory.getLogger(ForecastService.class);

    static final int MIN_HISTORY_DAYS = 14;
    static final int MIN_TEMPERATURE_POINTS = 10;
    static final int MIN_SEASONALITY_POINTS = 30;
    private static final double Z_95 = 1.96;
    private static final double DEFAULT_CONFIDENCE = 0.5;

    // mean monthly temperature, January first
    private static final double[] SEASONAL_TEMPERATURE = {
            5.0, 6.0, 10.0, 15.0, 20.0, 24.0, 28.0, 29.0, 25.0, 19.0, 13.0, 7.0
    };

    @Autowired
    private RegressionService regressionService;

    /**
     * @throws InsufficientDataException when fewer than 14 days of history are given
     */
    public ProductForecast forecastProductDemand(String productId, String productName,
                                                 List<SalesDataPoint> history, ForecastHorizon horizon) {
        if (history == null || history.size() < MIN_HISTORY_DAYS) {
            throw new InsufficientDataException(String.format(
                    "Forecast needs at least %d days of history, got %d",
                    MIN_HISTORY_DAYS, history == null ? 0 : history.size()));
        }
        ForecastHorizon effective = horizon == null ? ForecastHorizon.WEEK : horizon;
        int days = effective.getDays();
        List<SalesDataPoint> sorted = new ArrayList<>(history);
        sorted.sort(Comparator.comparing(SalesDataPoint::getDate));

        ProductStatistics stats = calculateProductStatistics(sorted);
        Map<DayOfWeek, Double> weekdayEffect = calculateWeekdayEffect(sorted);

        double[] temperatures = sorted.stream()
                .filter(SalesDataPoint::hasTemperature)
                .mapToDouble(SalesDataPoint::getTemperature)
                .toArray();
        double[] matchedSales = sorted.stream()
                .filter(SalesDataPoint::hasTemperature)
                .mapToDouble(SalesDataPoint::getSales)
                .toArray();
        RegressionModel regression = null;
        if (temperatures.length >= MIN_TEMPERATURE_POINTS) {
            try {
                regression = regressionService.linearRegression(temperatures, matchedSales);
            } catch (StatisticsException e) {
                logger.warn("Temperature regression failed for {}: {}", productId, e.getMessage());
            }
        }
        boolean useTemperature = regression != null && regression.getRSquared() > 0.1;
        double meanTemperature = StatisticsMath.mean(temperatures);
        double trend = calculateTrend(sorted);

        LocalDate lastDate = sorted.get(sorted.size() - 1).getDate();
        List<ForecastPoint> points = new ArrayList<>(days);
        double total = 0;
        for (int i = 1; i <= days; i++) {
            LocalDate date = lastDate.plusDays(i);
            double value = stats.getMean() * weekdayEffect.getOrDefault(date.getDayOfWeek(), 1.0);
            double seasonalTemperature = seasonalTemperature(date.getMonth());
            if (useTemperature) {
                value += regression.getSlope() * (seasonalTemperature - meanTemperature);
            }
            value += trend * i;

            points.add(new ForecastPoint(date, weekdayLabel(date.getDayOfWeek()), Math.max(0, value),
                    seasonalTemperature));
            // the total keeps the unclamped values
            total += value;
        }

        double margin = Z_95 * stats.getStdDev() * Math.sqrt(days);

        ProductForecast forecast = new ProductForecast();
        forecast.setProductId(productId);
        forecast.setProductName(productName);
        forecast.setHorizon(effective);
        forecast.setForecastPeriod(points.get(0).getDate() + " ~ " + points.get(points.size() - 1).getDate());
        forecast.setPredictedTotal(Math.max(0, total));
        forecast.setDailyAverage(Math.max(0, total / days));
        forecast.setConfidenceInterval(new ConfidenceInterval(Math.max(0, total - margin), total + margin, 0.95));
        forecast.setConfidence(regression != null ? regression.getRSquared() : DEFAULT_CONFIDENCE);
        forecast.setDailyBreakdown(points);
        forecast.setFactors(buildFactors(regression, weekdayEffect, stats));
        forecast.setSeasonality(detectSeasonality(sorted));
        forecast.setRecommendations(generateRecommendations(total, stats));
        forecast.setStatistics(stats);

        logger.info("Forecast {} for {} days: total={}, confidence={}",
                productId, days, String.format("%.1f", total), String.format("%.2f", forecast.getConfidence()));
        return forecast;
    }

    ProductStatistics calculateProductStatistics(List<SalesDataPoint> data) {
        double[] sales = data.stream().mapToDouble(SalesDataPoint::getSales).toArray();
        Map<DayOfWeek, List<Double>> byWeekday = new EnumMap<>(DayOfWeek.class);
        Map<Month, List<Double>> byMonth = new EnumMap<>(Month.class);
        for (SalesDataPoint point : data) {
            byWeekday.computeIfAbsent(point.getDayOfWeek(), k -> new ArrayList<>()).add(point.getSales());
            byMonth.computeIfAbsent(point.getDate().getMonth(), k -> new ArrayList<>()).add(point.getSales());
        }

        ProductStatistics stats = new ProductStatistics();
        stats.setMean(StatisticsMath.mean(sales));
        stats.setStdDev(StatisticsMath.stdDev(sales));
        stats.setMedian(StatisticsMath.upperMedian(sales));
        stats.setMin(Arrays.stream(sales).min().orElse(0));
        stats.setMax(Arrays.stream(sales).max().orElse(0));
        byWeekday.forEach((day, values) -> stats.getWeekdayAverage().put(day, meanOf(values)));
        byMonth.forEach((month, values) -> stats.getMonthlyAverage().put(month, meanOf(values)));

        double trend = calculateTrend(data);
        if (trend > 0.5) {
            stats.setTrendDirection("increasing");
        } else if (trend < -0.5) {
            stats.setTrendDirection("decreasing");
        } else {
            stats.setTrendDirection("stable");
        }
        return stats;
    }

    /**
     * Ratio of each weekday's mean to the overall mean; 1.0 is an average day.
     */
    Map<DayOfWeek, Double> calculateWeekdayEffect(List<SalesDataPoint> data) {
        double overall = StatisticsMath.mean(data.stream().mapToDouble(SalesDataPoint::getSales).toArray());
        Map<DayOfWeek, List<Double>> byWeekday = new EnumMap<>(DayOfWeek.class);
        for (SalesDataPoint point : data) {
            byWeekday.computeIfAbsent(point.getDayOfWeek(), k -> new ArrayList<>()).add(point.getSales());
        }
        Map<DayOfWeek, Double> effect = new EnumMap<>(DayOfWeek.class);
        if (overall == 0) {
            return effect;
        }
        byWeekday.forEach((day, values) -> effect.put(day, meanOf(values) / overall));
        return effect;
    }

    /**
     * Change per day between the mean of the first third and the mean of the last third.
     */
    static double calculateTrend(List<SalesDataPoint> data) {
        int n = data.size();
        int third = n / 3;
        if (third == 0) {
            return 0;
        }
        double early = 0;
        double late = 0;
        for (int i = 0; i < third; i++) {
            early += data.get(i).getSales();
        }
        for (int i = n - third; i < n; i++) {
            late += data.get(i).getSales();
        }
        return (late / third - early / third) / (n - third);
    }

    public static double seasonalTemperature(Month month) {
        return SEASONAL_TEMPERATURE[month.getValue() - 1];
    }

    static String weekdayLabel(DayOfWeek day) {
        return day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    /**
     * Compares the mean of the summer months (Jun-Aug) with the winter months (Dec-Feb).
     *
     * @return null with fewer than 30 points of history
     */
    String detectSeasonality(List<SalesDataPoint> data) {
        if (data.size() < MIN_SEASONALITY_POINTS) {
            return null;
        }
        Map<Month, List<Double>> byMonth = new EnumMap<>(Month.class);
        for (SalesDataPoint point : data) {
            byMonth.computeIfAbsent(point.getDate().getMonth(), k -> new ArrayList<>()).add(point.getSales());
        }
        double summerSum = 0;
        double winterSum = 0;
        int summerCount = 0;
        int winterCount = 0;
        for (Map.Entry<Month, List<Double>> entry : byMonth.entrySet()) {
            int month = entry.getKey().getValue();
            double avg = meanOf(entry.getValue());
            if (month >= 6 && month <= 8) {
                summerSum += avg;
                summerCount++;
            } else if (month == 12 || month <= 2) {
                winterSum += avg;
                winterCount++;
            }
        }
        if (summerCount > 0 && winterCount > 0 && winterSum > 0) {
            double summer = summerSum / summerCount;
            double winter = winterSum / winterCount;
            double diff = (summer - winter) / winter * 100;
            if (diff > 20) {
                return String.format("Summer demand tends to be higher (+%.0f%% vs winter)", diff);
            } else if (diff < -20) {
                return String.format("Winter demand tends to be higher (+%.0f%% vs summer)", -diff);
            }
        }
        return "No clear seasonality detected";
    }

    List<String> generateRecommendations(double forecastTotal, ProductStatistics stats) {
        List<String> recommendations = new ArrayList<>();
        if (forecastTotal > stats.getMean() * 1.2) {
            recommendations.add(String.format(
                    "Forecast demand is above average; secure enough stock (forecast: %.0f, average: %.0f)",
                    forecastTotal, stats.getMean()));
        } else if (forecastTotal < stats.getMean() * 0.8) {
            recommendations.add("Forecast demand is below average; watch for overstock");
        }

        stats.getWeekdayAverage().entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .max(Map.Entry.comparingByValue())
                .ifPresent(e -> recommendations.add(weekdayLabel(e.getKey()) + " tends to have the highest demand"));

        if ("increasing".equals(stats.getTrendDirection())) {
            recommendations.add("Demand is trending up; consider strengthening supply");
        } else if ("decreasing".equals(stats.getTrendDirection())) {
            recommendations.add("Demand is trending down; review marketing measures");
        }
        return recommendations;
    }

    private List<String> buildFactors(RegressionModel regression, Map<DayOfWeek, Double> weekdayEffect,
                                      ProductStatistics stats) {
        List<String> factors = new ArrayList<>();
        factors.add(String.format("Historical sales (average %.0f units/day)", stats.getMean()));
        factors.add("Trend direction: " + stats.getTrendDirection());
        if (!weekdayEffect.isEmpty()) {
            factors.add("Weekday demand variation");
        }
        if (regression != null && regression.getRSquared() > 0.1) {
            factors.add(String.format("Temperature correlation (R² = %.2f)", regression.getRSquared()));
        }
        factors.add("Seasonal pattern analysis");
        return factors;
    }

    private static double meanOf(List<Double> values) {
        return StatisticsMath.mean(values.stream().mapToDouble(Double::doubleValue).toArray());
    }
}
