package com.bmsedge.analytics.service;

import com.bmsedge.analytics.config.AnalyticsProperties;
import com.bmsedge.analytics.dto.AnalysisReport;
import com.bmsedge.analytics.dto.BatchAnalysisResult;
import com.bmsedge.analytics.dto.CorrelationResult;
import com.bmsedge.analytics.dto.RegressionModel;
import com.bmsedge.analytics.dto.StatisticalSummary;
import com.bmsedge.analytics.exception.InsufficientDataException;
import com.bmsedge.analytics.exception.StatisticsException;
import com.bmsedge.analytics.model.Observation;
import com.bmsedge.analytics.model.ObservationSeries;
import com.bmsedge.analytics.model.WeatherObservation;
import com.bmsedge.analytics.util.StatisticsMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds per-product analysis reports and runs them for many products on the worker pool.
 */
@Service
public class SalesAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SalesAnalysisService.class);

    @Autowired
    private ExternalFactorCorrelationService externalFactorCorrelationService;

    @Autowired
    private WeatherDataService weatherDataService;

    @Autowired
    private RegressionService regressionService;

    @Autowired
    private AnalyticsProperties properties;

    @Autowired
    @Qualifier("analysisExecutor")
    private ThreadPoolTaskExecutor analysisExecutor;

    /**
     * @throws InsufficientDataException when the series is empty
     */
    public StatisticalSummary generateStatisticalSummary(ObservationSeries sales) {
        if (sales == null || sales.isEmpty()) {
            throw new InsufficientDataException("Sales series is empty");
        }
        double[] values = sales.values();
        double total = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : values) {
            total += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new StatisticalSummary(values.length, total / values.length, StatisticsMath.upperMedian(values),
                StatisticsMath.stdDev(values), min, max, total);
    }

    /**
     * Weather and economic correlations, summary statistics and a sales-on-temperature regression.
     * A failing correlation step contributes an empty list instead of failing the report.
     */
    public AnalysisReport createAnalysisReport(String productId, ObservationSeries sales, String regionCode) {
        if (sales == null || sales.isEmpty()) {
            throw new InsufficientDataException("No sales data for product " + productId);
        }
        String region = regionCode == null || regionCode.isBlank()
                ? properties.getWeather().getDefaultRegion() : regionCode;

        List<CorrelationResult> correlations = new ArrayList<>();
        try {
            correlations.addAll(externalFactorCorrelationService.analyzeSalesWeatherCorrelation(sales, region));
        } catch (StatisticsException e) {
            logger.warn("Weather correlation failed for {}: {}", productId, e.getMessage());
        }
        try {
            correlations.addAll(externalFactorCorrelationService.analyzeSalesEconomicCorrelation(sales, null, 0));
        } catch (StatisticsException e) {
            logger.warn("Economic correlation failed for {}: {}", productId, e.getMessage());
        }

        AnalysisReport report = new AnalysisReport();
        report.setReportId(UUID.randomUUID().toString());
        report.setProductId(productId);
        report.setDataPoints(sales.size());
        report.setStartDate(sales.firstDate());
        report.setEndDate(sales.lastDate());
        report.setSummary(generateStatisticalSummary(sales));
        report.setCorrelations(correlations);

        List<Double> temps = new ArrayList<>();
        List<Double> matchedSales = new ArrayList<>();
        try {
            Map<LocalDate, Double> temperatureByDate = new HashMap<>();
            for (WeatherObservation w : weatherDataService.getHistoricalWeather(
                    region, sales.firstDate(), sales.lastDate())) {
                temperatureByDate.put(w.getDate(), w.getTemperature());
            }
            for (Observation o : sales.getObservations()) {
                Double temperature = temperatureByDate.get(o.getDate());
                if (temperature != null) {
                    temps.add(temperature);
                    matchedSales.add(o.getValue());
                }
            }
        } catch (StatisticsException e) {
            logger.warn("Weather lookup failed for {}: {}", productId, e.getMessage());
        }
        report.setWeatherMatches(temps.size());
        logger.debug("Matched {} of {} sales dates with weather for {}", temps.size(), sales.size(), productId);

        if (temps.size() >= 2) {
            try {
                report.setRegression(regressionService.linearRegression(toArray(temps), toArray(matchedSales)));
            } catch (StatisticsException e) {
                logger.warn("Temperature regression failed for {}: {}", productId, e.getMessage());
            }
        }
        report.setRecommendations(generateRecommendations(correlations, report.getRegression()));

        logger.info("Analysis report {} for {}: {} points, {} correlations, {} weather matches",
                report.getReportId(), productId, sales.size(), correlations.size(), report.getWeatherMatches());
        return report;
    }

    /**
     * Runs {@link #createAnalysisReport} for every product on the analysis pool. Products are
     * independent; one that fails is counted and reported while the others carry on.
     */
    public BatchAnalysisResult analyzeProducts(Map<String, ObservationSeries> products, String regionCode) {
        logger.info("Starting batch analysis of {} products", products.size());
        long startTime = System.currentTimeMillis();

        BatchAnalysisResult result = new BatchAnalysisResult();
        result.setTotalProducts(products.size());

        Map<String, Future<AnalysisReport>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, ObservationSeries> entry : products.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                result.setNoDataCount(result.getNoDataCount() + 1);
                continue;
            }
            String productId = entry.getKey();
            ObservationSeries series = entry.getValue();
            futures.put(productId, analysisExecutor.submit(() -> createAnalysisReport(productId, series, regionCode)));
        }

        long deadline = startTime + TimeUnit.SECONDS.toMillis(properties.getBatch().getTimeoutSeconds());
        for (Map.Entry<String, Future<AnalysisReport>> entry : futures.entrySet()) {
            String productId = entry.getKey();
            Future<AnalysisReport> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.currentTimeMillis());
                result.getReports().put(productId, future.get(remaining, TimeUnit.MILLISECONDS));
                result.setSuccessCount(result.getSuccessCount() + 1);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                recordFailure(result, productId, cause.getMessage());
            } catch (TimeoutException e) {
                future.cancel(true);
                recordFailure(result, productId, "timed out");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                recordFailure(result, productId, "interrupted");
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        result.setDurationMs(duration);
        logger.info("Batch analysis completed in {}ms. Success: {}, No Data: {}, Failed: {}",
                duration, result.getSuccessCount(), result.getNoDataCount(), result.getFailCount());
        return result;
    }

    private static void recordFailure(BatchAnalysisResult result, String productId, String message) {
        result.setFailCount(result.getFailCount() + 1);
        result.getErrors().add("Product " + productId + ": " + message);
        logger.error("Error analyzing product {}: {}", productId, message);
    }

    List<String> generateRecommendations(List<CorrelationResult> correlations, RegressionModel regression) {
        List<String> recommendations = new ArrayList<>();

        for (CorrelationResult corr : correlations) {
            if (corr.getAbsoluteCoefficient() <= 0.5 || corr.getPValue() >= CorrelationService.SIGNIFICANCE_LEVEL) {
                continue;
            }
            String label = corr.getLabel();
            if (label.startsWith("temperature_")) {
                recommendations.add(corr.getCoefficient() > 0
                        ? "Sales rise with temperature. Build up stock for the summer season."
                        : "Sales rise as temperature falls. Build up stock for the winter season.");
            } else if (label.startsWith("humidity_")) {
                recommendations.add("Sales are significantly correlated with humidity. "
                        + "Consider tying stock management to the weather forecast.");
            } else if (label.contains("NIKKEI")) {
                recommendations.add(corr.getCoefficient() > 0
                        ? String.format("Positive correlation with the Nikkei index (r = %.2f). "
                        + "Stock market movements may help forecast demand.", corr.getCoefficient())
                        : String.format("Negative correlation with the Nikkei index (r = %.2f). "
                        + "Demand may grow during downturns.", corr.getCoefficient()));
            } else if (label.contains("USDJPY")) {
                recommendations.add(String.format("Correlation with the USD/JPY exchange rate (r = %.2f). "
                        + "Consider imported materials and inbound tourist demand.", corr.getCoefficient()));
            } else if (label.contains("WTI")) {
                recommendations.add(String.format("Correlation with crude oil prices (r = %.2f). "
                        + "Watch transport costs and consumer sentiment.", corr.getCoefficient()));
            }
        }

        for (CorrelationResult corr : correlations) {
            if (corr.isLagged() && corr.getAbsoluteCoefficient() > 0.4
                    && corr.getPValue() < CorrelationService.SIGNIFICANCE_LEVEL) {
                recommendations.add(String.format("Time lag detected: %s (r = %.2f). "
                        + "Usable as a leading indicator.", corr.getLabel(), corr.getCoefficient()));
            }
        }

        if (regression != null && regression.getRSquared() > 0.3) {
            recommendations.add(String.format("The temperature model explains %.1f%% of the variance. "
                    + "Weather-based demand forecasting is worthwhile.", regression.getRSquared() * 100));
        }

        if (correlations.isEmpty()) {
            recommendations.add("Sales dates did not match any external data. "
                    + "Check the date format (YYYY-MM-DD recommended).");
            recommendations.add("Check that the external data covers the same period as the sales data.");
        }

        if (recommendations.isEmpty()) {
            recommendations.add("More data will allow a more precise analysis.");
            recommendations.add("Consider a multivariate analysis that includes seasonality and weekday effects.");
        }
        return recommendations;
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
