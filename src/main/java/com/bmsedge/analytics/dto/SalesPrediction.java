package com.bmsedge.analytics.dto;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Sales predicted from a temperature regression.
 */
@Getter
@ToString
public final class SalesPrediction {

    private final double predictedValue;
    private final ConfidenceInterval confidenceInterval;
    // R² of the underlying model
    private final double confidence;
    private final List<String> predictionFactors;
    private final String regressionEquation;

    public SalesPrediction(double predictedValue, ConfidenceInterval confidenceInterval, double confidence,
                           List<String> predictionFactors, String regressionEquation) {
        this.predictedValue = predictedValue;
        this.confidenceInterval = confidenceInterval;
        this.confidence = confidence;
        this.predictionFactors = List.copyOf(predictionFactors);
        this.regressionEquation = regressionEquation;
    }
}
