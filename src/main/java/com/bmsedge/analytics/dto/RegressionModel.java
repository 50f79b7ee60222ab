package com.bmsedge.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Single-predictor least-squares fit y = slope·x + intercept.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class RegressionModel {

    private final double slope;
    private final double intercept;
    private final double rSquared;
    // fitted value at the last x of the training data
    private final double prediction;
    private final String equation;

    public RegressionModel(double slope, double intercept, double rSquared, double prediction, String equation) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
        this.prediction = prediction;
        this.equation = equation;
    }

    @JsonProperty("rSquared")
    public double getRSquared() {
        return rSquared;
    }

    public double getConfidence() {
        return rSquared;
    }

    public double predict(double x) {
        return slope * x + intercept;
    }
}
