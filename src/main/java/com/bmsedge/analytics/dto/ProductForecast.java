package com.bmsedge.analytics.dto;

import com.bmsedge.analytics.model.ForecastHorizon;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Day-by-day demand forecast for one product.
 */
@Setter
@Getter
public class ProductForecast {
    private String productId;
    private String productName;
    private ForecastHorizon horizon;
    private String forecastPeriod;
    private double predictedTotal;
    private double dailyAverage;
    private ConfidenceInterval confidenceInterval;
    // R² of the temperature model, 0.5 when none was fitted
    private double confidence;
    private List<ForecastPoint> dailyBreakdown;
    private List<String> factors;
    private String seasonality;
    private List<String> recommendations;
    private ProductStatistics statistics;
    private LocalDateTime generatedAt;

    public ProductForecast() {
        this.generatedAt = LocalDateTime.now();
    }
}
