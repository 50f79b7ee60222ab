package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.ConfidenceInterval;
import com.bmsedge.analytics.dto.GrangerResult;
import com.bmsedge.analytics.dto.RegressionModel;
import com.bmsedge.analytics.dto.SalesPrediction;
import com.bmsedge.analytics.exception.DegenerateInputException;
import com.bmsedge.analytics.exception.ErrorKind;
import com.bmsedge.analytics.exception.InsufficientDataException;
import com.bmsedge.analytics.exception.InvalidParameterException;
import com.bmsedge.analytics.util.LinearSystemSolver;
import com.bmsedge.analytics.util.StatisticsMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Least-squares regression and the Granger causality F-test built on it.
 */
@Service
public class RegressionService {

    private static final Logger logger = LoggerFactory.getLogger(RegressionService.class);

    static final int MIN_PREDICTION_POINTS = 10;

    /**
     * Closed-form OLS fit of y on x.
     *
     * @throws InsufficientDataException when there are fewer than two points or the lengths differ
     * @throws DegenerateInputException  when every x is the same
     */
    public RegressionModel linearRegression(double[] x, double[] y) {
        if (x.length != y.length || x.length < 2) {
            throw new InsufficientDataException(String.format(
                    "Regression needs two or more paired points (x=%d, y=%d)", x.length, y.length));
        }
        int n = x.length;
        double meanX = StatisticsMath.mean(x);
        double meanY = StatisticsMath.mean(y);
        // centered sums keep their precision when x carries a large offset
        double sxx = 0;
        double sxy = 0;
        double ssTotal = 0;
        boolean constantX = true;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxx += dx * dx;
            sxy += dx * dy;
            ssTotal += dy * dy;
            constantX &= x[i] == x[0];
        }
        if (constantX || sxx == 0) {
            throw new DegenerateInputException("Predictor has zero variance");
        }
        double slope = sxy / sxx;
        double intercept = meanY - slope * meanX;

        double ssResidual = 0;
        for (int i = 0; i < n; i++) {
            double residual = y[i] - (meanY + slope * (x[i] - meanX));
            ssResidual += residual * residual;
        }
        // constant y: nothing to explain
        double rSquared = ssTotal == 0 ? 0 : Math.max(0, 1 - ssResidual / ssTotal);

        double prediction = meanY + slope * (x[n - 1] - meanX);
        String equation = String.format("y = %.2fx + %.2f (R² = %.3f)", slope, intercept, rSquared);
        return new RegressionModel(slope, intercept, rSquared, prediction, equation);
    }

    /**
     * Residual sum of squares of the no-intercept fit y ~ design.
     *
     * @param design one row per observation, one column per predictor
     */
    double residualSumOfSquares(double[] y, double[][] design) {
        int n = y.length;
        if (n == 0) {
            return 0;
        }
        if (design.length != n) {
            throw new InvalidParameterException(String.format(
                    "Design matrix has %d rows for %d observations", design.length, n));
        }
        int k = design[0].length;
        if (k == 0) {
            double ss = 0;
            for (double v : y) {
                ss += v * v;
            }
            return ss;
        }

        double[][] xtx = new double[k][k];
        double[] xty = new double[k];
        for (int t = 0; t < n; t++) {
            double[] row = design[t];
            if (row.length != k) {
                throw new InvalidParameterException("Ragged design matrix at row " + t);
            }
            for (int i = 0; i < k; i++) {
                xty[i] += row[i] * y[t];
                for (int j = 0; j < k; j++) {
                    xtx[i][j] += row[i] * row[j];
                }
            }
        }
        double[] beta = LinearSystemSolver.solveSymmetricPositiveDefinite(xtx, xty);

        double rss = 0;
        for (int t = 0; t < n; t++) {
            double predicted = 0;
            for (int i = 0; i < k; i++) {
                predicted += beta[i] * design[t][i];
            }
            double residual = y[t] - predicted;
            rss += residual * residual;
        }
        return rss;
    }

    /**
     * Tests whether the past lagOrder values of x improve the prediction of y beyond y's own past.
     * Both series are de-meaned first and neither model has an intercept.
     *
     * @throws InsufficientDataException when the series are shorter than 2·lagOrder + 10
     */
    public GrangerResult grangerCausality(double[] y, double[] x, int lagOrder) {
        if (lagOrder < 1) {
            throw new InvalidParameterException("lagOrder must be at least 1, got " + lagOrder);
        }
        if (y.length != x.length) {
            throw new InvalidParameterException(String.format(
                    "Series differ in length (y=%d, x=%d)", y.length, x.length));
        }
        int total = y.length;
        if (total < 2 * lagOrder + 10) {
            throw new InsufficientDataException(String.format(
                    "Granger test with lag order %d needs at least %d points, got %d",
                    lagOrder, 2 * lagOrder + 10, total), ErrorKind.INSUFFICIENT_SAMPLES);
        }
        int df2 = total - 2 * lagOrder;
        if (df2 <= 0) {
            throw new InsufficientDataException("No residual degrees of freedom left", ErrorKind.INSUFFICIENT_SAMPLES);
        }

        double meanY = StatisticsMath.mean(y);
        double meanX = StatisticsMath.mean(x);
        double[] yc = new double[total];
        double[] xc = new double[total];
        for (int i = 0; i < total; i++) {
            yc[i] = y[i] - meanY;
            xc[i] = x[i] - meanX;
        }

        int rows = total - lagOrder;
        double[][] restricted = new double[rows][lagOrder];
        double[][] full = new double[rows][2 * lagOrder];
        double[] target = new double[rows];
        for (int i = 0; i < rows; i++) {
            target[i] = yc[lagOrder + i];
            for (int lag = 0; lag < lagOrder; lag++) {
                restricted[i][lag] = yc[lagOrder - 1 - lag + i];
                full[i][lag] = yc[lagOrder - 1 - lag + i];
                full[i][lagOrder + lag] = xc[lagOrder - 1 - lag + i];
            }
        }

        double rssRestricted = residualSumOfSquares(target, restricted);
        double rssFull = residualSumOfSquares(target, full);

        double f;
        if (rssFull <= 0) {
            f = rssRestricted > 0 ? Double.POSITIVE_INFINITY : 0;
        } else {
            f = ((rssRestricted - rssFull) / lagOrder) / (rssFull / df2);
        }
        double p = StatisticsMath.fDistSurvival(f, lagOrder, df2);
        logger.debug("Granger lag order {}: RSS restricted={}, full={}, F={}, p={}",
                lagOrder, rssRestricted, rssFull, f, p);
        return new GrangerResult(f, p, lagOrder, df2);
    }

    /**
     * Removes the least-squares line fitted against the index 1..n.
     */
    public double[] detrend(double[] values) {
        int n = values.length;
        if (n < 2) {
            return values.clone();
        }
        double[] index = new double[n];
        for (int i = 0; i < n; i++) {
            index[i] = i + 1;
        }
        RegressionModel model = linearRegression(index, values);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = values[i] - model.predict(index[i]);
        }
        return out;
    }

    /**
     * Predicts sales for a future temperature from a sales-on-temperature regression.
     *
     * @param confidenceLevel 0.90, 0.95 or 0.99; 0 means 0.95, any other value uses the 95% z-score
     */
    public SalesPrediction predictFutureSales(double[] historicalSales, double[] historicalTemperatures,
                                              double futureTemperature, double confidenceLevel) {
        if (historicalSales.length != historicalTemperatures.length) {
            throw new InvalidParameterException(String.format(
                    "Sales and temperatures differ in length (%d vs %d)",
                    historicalSales.length, historicalTemperatures.length));
        }
        if (historicalSales.length < MIN_PREDICTION_POINTS) {
            throw new InsufficientDataException(String.format(
                    "Prediction needs at least %d points, got %d", MIN_PREDICTION_POINTS, historicalSales.length));
        }

        RegressionModel model = linearRegression(historicalTemperatures, historicalSales);
        double predicted = model.predict(futureTemperature);

        double[] residuals = new double[historicalSales.length];
        for (int i = 0; i < residuals.length; i++) {
            residuals[i] = historicalSales[i] - model.predict(historicalTemperatures[i]);
        }
        double residualStdDev = StatisticsMath.stdDev(residuals);

        double level = confidenceLevel == 0 ? 0.95 : confidenceLevel;
        double margin = zScoreFor(level) * residualStdDev;

        List<String> factors = new ArrayList<>();
        factors.add(String.format("Regression prediction for a temperature of %.1f°C", futureTemperature));
        factors.add(String.format("Trained on %d historical points", historicalSales.length));
        factors.add(String.format("Coefficient of determination R² = %.3f", model.getRSquared()));
        if (model.getRSquared() > 0.5) {
            factors.add("Temperature and sales are strongly related, so the prediction is reliable");
        } else if (model.getRSquared() > 0.3) {
            factors.add("Temperature and sales are related, but other factors also matter");
        } else {
            factors.add("Factors other than temperature are likely driving sales");
        }

        return new SalesPrediction(predicted,
                new ConfidenceInterval(predicted - margin, predicted + margin, level),
                model.getConfidence(),
                factors,
                String.format("y = %.2fx + %.2f", model.getSlope(), model.getIntercept()));
    }

    static double zScoreFor(double confidenceLevel) {
        if (confidenceLevel == 0.90) {
            return 1.645;
        } else if (confidenceLevel == 0.99) {
            return 2.576;
        }
        return 1.96;
    }
}
