package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.GrangerResult;
import com.bmsedge.analytics.dto.RegressionModel;
import com.bmsedge.analytics.dto.SalesPrediction;
import com.bmsedge.analytics.exception.DegenerateInputException;
import com.bmsedge.analytics.exception.ErrorKind;
import com.bmsedge.analytics.exception.InsufficientDataException;
import com.bmsedge.analytics.exception.InvalidParameterException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RegressionService
 */
class RegressionServiceTest {

    private RegressionService regressionService;

    @BeforeEach
    void setUp() {
        regressionService = new RegressionService();
    }

    @Test
    @DisplayName("Should fit an exact line")
    void testLinearRegressionExactLine() {
        // Arrange
        double[] x = {10, 20, 30, 40, 50};
        double[] y = {100, 150, 200, 250, 300};

        // Act
        RegressionModel model = regressionService.linearRegression(x, y);

        // Assert
        assertEquals(5.0, model.getSlope(), 1e-9);
        assertEquals(50.0, model.getIntercept(), 1e-9);
        assertEquals(1.0, model.getRSquared(), 1e-9);
        assertEquals(300.0, model.getPrediction(), 1e-9);
        assertEquals(model.getRSquared(), model.getConfidence());
        assertEquals("y = 5.00x + 50.00 (R² = 1.000)", model.getEquation());
    }

    @Test
    @DisplayName("Should report R² of 0 for a constant response")
    void testLinearRegressionConstantY() {
        RegressionModel model = regressionService.linearRegression(new double[]{1, 2, 3}, new double[]{7, 7, 7});

        assertEquals(0.0, model.getSlope(), 1e-12);
        assertEquals(7.0, model.getIntercept(), 1e-12);
        assertEquals(0.0, model.getRSquared());
    }

    @Test
    @DisplayName("Should fit x values that carry a large offset")
    void testLinearRegressionLargeOffsetX() {
        // Arrange: epoch-second sized x with a variance of 2
        double[] x = new double[5];
        for (int i = 0; i < 5; i++) {
            x[i] = 1.7e9 + i + 1;
        }
        double[] y = {2.1, 3.9, 6.2, 7.8, 10.1};

        // Act
        RegressionModel model = regressionService.linearRegression(x, y);

        // Assert
        assertEquals(1.99, model.getSlope(), 1e-9);
        assertEquals(1 - 0.107 / 39.708, model.getRSquared(), 1e-9);
        assertEquals(10.0, model.getPrediction(), 1e-6);
    }

    @Test
    @DisplayName("Should match the reference fit on noisy data and keep R² within [0, 1]")
    void testLinearRegressionNoisyDataMatchesReference() {
        // Arrange
        double[] x = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};
        double[] noise = {0.8, -1.2, 0.3, 1.9, -0.7, -2.1, 1.4, 0.2, -0.9, 1.1, -0.4, 0.6};
        double[] y = new double[x.length];
        SimpleRegression reference = new SimpleRegression();
        for (int i = 0; i < x.length; i++) {
            y[i] = 3 + 2 * x[i] + noise[i];
            reference.addData(x[i], y[i]);
        }

        // Act
        RegressionModel model = regressionService.linearRegression(x, y);

        // Assert
        assertEquals(reference.getSlope(), model.getSlope(), 1e-9);
        assertEquals(reference.getIntercept(), model.getIntercept(), 1e-9);
        assertEquals(reference.getRSquare(), model.getRSquared(), 1e-9);
        assertTrue(model.getRSquared() > 0);
        assertTrue(model.getRSquared() < 1);
    }

    @Test
    @DisplayName("Should keep R² within [0, 1] across random samples")
    void testLinearRegressionRSquaredBounds() {
        Random random = new Random(11);
        for (int sample = 0; sample < 20; sample++) {
            int n = 5 + random.nextInt(30);
            double[] x = new double[n];
            double[] y = new double[n];
            for (int i = 0; i < n; i++) {
                x[i] = random.nextDouble() * 100;
                y[i] = random.nextGaussian() * 10 + (sample % 2 == 0 ? 0.5 * x[i] : 0);
            }

            RegressionModel model = regressionService.linearRegression(x, y);

            assertTrue(model.getRSquared() >= 0, "R² below 0 in sample " + sample);
            assertTrue(model.getRSquared() < 1, "R² reached 1 with non-zero residuals in sample " + sample);
        }
    }

    @Test
    @DisplayName("Should reject too few points and a constant predictor")
    void testLinearRegressionValidation() {
        assertThrows(InsufficientDataException.class,
                () -> regressionService.linearRegression(new double[]{1}, new double[]{2}));
        assertThrows(InsufficientDataException.class,
                () -> regressionService.linearRegression(new double[]{1, 2, 3}, new double[]{2, 3}));
        DegenerateInputException ex = assertThrows(DegenerateInputException.class,
                () -> regressionService.linearRegression(new double[]{4, 4, 4}, new double[]{1, 2, 3}));
        assertEquals(ErrorKind.DEGENERATE_INPUT, ex.getKind());
        assertThrows(DegenerateInputException.class,
                () -> regressionService.linearRegression(new double[]{0.1, 0.1, 0.1, 0.1, 0.1},
                        new double[]{1, 2, 3, 4, 5}));
    }

    @Test
    @DisplayName("Should match the reference residual sum of squares for a no-intercept fit")
    void testResidualSumOfSquares() {
        // Arrange
        Random random = new Random(7);
        int n = 40;
        double[][] design = new double[n][3];
        double[] y = new double[n];
        for (int t = 0; t < n; t++) {
            design[t][0] = random.nextGaussian();
            design[t][1] = random.nextGaussian();
            design[t][2] = random.nextGaussian();
            y[t] = 1.5 * design[t][0] - 2 * design[t][1] + 0.5 * design[t][2] + random.nextGaussian();
        }
        OLSMultipleLinearRegression reference = new OLSMultipleLinearRegression();
        reference.setNoIntercept(true);
        reference.newSampleData(y, design);

        // Act
        double rss = regressionService.residualSumOfSquares(y, design);

        // Assert
        assertEquals(reference.calculateResidualSumOfSquares(), rss, 1e-8);
    }

    @Test
    @DisplayName("Should return the sum of squares when there are no predictors")
    void testResidualSumOfSquaresWithoutPredictors() {
        double[] y = {1, -2, 3};

        assertEquals(14.0, regressionService.residualSumOfSquares(y, new double[3][0]), 1e-12);
        assertEquals(0.0, regressionService.residualSumOfSquares(new double[0], new double[0][0]));
        assertThrows(InvalidParameterException.class,
                () -> regressionService.residualSumOfSquares(y, new double[2][1]));
    }

    @Test
    @DisplayName("Should detect that a leading series Granger-causes the response")
    void testGrangerCausalityDetectsLeadingSeries() {
        // Arrange: y(t) depends on x(t - 1)
        Random random = new Random(42);
        int n = 120;
        double[] x = new double[n];
        double[] y = new double[n];
        for (int t = 0; t < n; t++) {
            x[t] = random.nextGaussian();
        }
        for (int t = 1; t < n; t++) {
            y[t] = 0.8 * x[t - 1] + 0.2 * random.nextGaussian();
        }

        // Act
        GrangerResult result = regressionService.grangerCausality(y, x, 2);

        // Assert
        assertTrue(result.getFStatistic() > 10);
        assertTrue(result.getPValue() < 0.001);
        assertTrue(result.isSignificant(0.05));
        assertEquals(2, result.getLagOrder());
        assertEquals(n - 4, result.getDenominatorDegreesOfFreedom());
    }

    @Test
    @DisplayName("Should keep F and p in range for unrelated series")
    void testGrangerCausalityUnrelatedSeries() {
        Random random = new Random(3);
        double[] x = new double[60];
        double[] y = new double[60];
        for (int t = 0; t < 60; t++) {
            x[t] = random.nextGaussian();
            y[t] = random.nextGaussian();
        }

        GrangerResult result = regressionService.grangerCausality(y, x, 3);

        assertTrue(result.getFStatistic() >= 0);
        assertTrue(result.getPValue() >= 0 && result.getPValue() <= 1);
    }

    @Test
    @DisplayName("Should require 2·lagOrder + 10 observations")
    void testGrangerCausalityTooShort() {
        double[] series = new double[13];
        for (int i = 0; i < series.length; i++) {
            series[i] = i % 4;
        }

        InsufficientDataException ex = assertThrows(InsufficientDataException.class,
                () -> regressionService.grangerCausality(series, series, 2));
        assertEquals(ErrorKind.INSUFFICIENT_SAMPLES, ex.getKind());
        assertThrows(InvalidParameterException.class,
                () -> regressionService.grangerCausality(series, series, 0));
        assertThrows(InvalidParameterException.class,
                () -> regressionService.grangerCausality(series, new double[12], 1));
    }

    @Test
    @DisplayName("Should remove a linear trend")
    void testDetrend() {
        double[] values = {5, 8, 11, 14, 17, 20};

        double[] detrended = regressionService.detrend(values);

        for (double v : detrended) {
            assertEquals(0.0, v, 1e-9);
        }
        assertArrayEquals(new double[]{3}, regressionService.detrend(new double[]{3}));
    }

    @Test
    @DisplayName("Should predict sales for a future temperature with an interval")
    void testPredictFutureSales() {
        // Arrange
        double[] temps = {10, 12, 14, 16, 18, 20, 22, 24, 26, 28};
        double[] sales = new double[temps.length];
        for (int i = 0; i < temps.length; i++) {
            sales[i] = 5 * temps[i] + 100 + (i % 2 == 0 ? 3 : -3);
        }

        // Act
        SalesPrediction prediction = regressionService.predictFutureSales(sales, temps, 30, 0);

        // Assert
        assertEquals(250.0, prediction.getPredictedValue(), 2.0);
        assertEquals(0.95, prediction.getConfidenceInterval().getConfidence());
        assertTrue(prediction.getConfidenceInterval().getLower() < prediction.getPredictedValue());
        assertTrue(prediction.getConfidenceInterval().getUpper() > prediction.getPredictedValue());
        assertTrue(prediction.getConfidence() > 0.9);
        assertEquals(4, prediction.getPredictionFactors().size());
        assertTrue(prediction.getRegressionEquation().startsWith("y = "));
    }

    @Test
    @DisplayName("Should require ten matching points for a prediction")
    void testPredictFutureSalesValidation() {
        assertThrows(InsufficientDataException.class,
                () -> regressionService.predictFutureSales(new double[9], new double[9], 20, 0.95));
        assertThrows(InvalidParameterException.class,
                () -> regressionService.predictFutureSales(new double[10], new double[11], 20, 0.95));
    }

    @Test
    @DisplayName("Should map confidence levels to z-scores")
    void testZScoreFor() {
        assertEquals(1.645, RegressionService.zScoreFor(0.90));
        assertEquals(1.96, RegressionService.zScoreFor(0.95));
        assertEquals(2.576, RegressionService.zScoreFor(0.99));
        assertEquals(1.96, RegressionService.zScoreFor(0.5));
    }
}
