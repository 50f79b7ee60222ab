package com.bmsedge.analytics.util;

import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Gamma;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Numeric primitives shared by the correlation, regression and anomaly engines.
 * <p>
 * All statistics are population statistics. Functions never mutate their input arrays.
 */
public final class StatisticsMath {

    private static final int BETA_MAX_ITERATIONS = 200;
    private static final double BETA_EPSILON = 3e-7;

    private StatisticsMath() {
    }

    /**
     * Arithmetic mean, 0 for an empty input.
     */
    public static double mean(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation, 0 for an empty input.
     */
    public static double stdDev(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Median; the two middle values are averaged for even lengths. 0 for an empty input.
     */
    public static double median(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return (sorted[mid - 1] + sorted[mid]) / 2;
        }
        return sorted[mid];
    }

    /**
     * Element at index n/2 of the sorted input. Used by the summary reports.
     */
    public static double upperMedian(double[] values) {
        if (values == null || values.length == 0) {
            return 0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted[sorted.length / 2];
    }

    /**
     * Natural logarithm of the gamma function for x &gt; 0.
     */
    public static double logGamma(double x) {
        return Gamma.logGamma(x);
    }

    /**
     * Regularized incomplete beta function I_x(a, b), evaluated by continued fraction with a
     * tolerance of 3e-7 and at most 200 iterations.
     *
     * @return a value in [0, 1]; 0 when x &lt;= 0 and 1 when x &gt;= 1
     */
    public static double regularizedIncompleteBeta(double a, double b, double x) {
        if (x <= 0) {
            return 0;
        }
        if (x >= 1) {
            return 1;
        }
        double result = Beta.regularizedBeta(x, a, b, BETA_EPSILON, BETA_MAX_ITERATIONS);
        return Math.min(1, Math.max(0, result));
    }

    /**
     * Cumulative distribution function of Student's t with df degrees of freedom.
     */
    public static double studentTCdf(double t, double df) {
        if (t == 0) {
            return 0.5;
        }
        double z = df / (df + t * t);
        double ib = regularizedIncompleteBeta(0.5 * df, 0.5, z);
        if (t > 0) {
            return 1 - 0.5 * ib;
        }
        return 0.5 * ib;
    }

    /**
     * Survival function P(F &gt;= f) of the F distribution with (d1, d2) degrees of freedom.
     */
    public static double fDistSurvival(double f, double d1, double d2) {
        if (f <= 0) {
            return 1.0;
        }
        return regularizedIncompleteBeta(d2 / 2, d1 / 2, d2 / (d2 + d1 * f));
    }

    /**
     * Benjamini-Hochberg false-discovery-rate adjustment.
     *
     * @param pValues raw p-values, not modified
     * @return adjusted p-values in the original order, each in [raw p, 1]
     */
    public static double[] benjaminiHochberg(double[] pValues) {
        int n = pValues.length;
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> pValues[i]));

        double[] adjusted = new double[n];
        double previous = 1.0;
        for (int rank = n; rank >= 1; rank--) {
            int index = order[rank - 1];
            double value = pValues[index] * n / rank;
            value = Math.min(value, previous);
            value = Math.min(value, 1.0);
            adjusted[index] = value;
            previous = value;
        }
        return adjusted;
    }

    /**
     * First differences x[i] - x[i-1]; inputs shorter than 2 are returned as a copy.
     */
    public static double[] firstDifference(double[] values) {
        if (values.length < 2) {
            return values.clone();
        }
        double[] out = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            out[i - 1] = values[i] - values[i - 1];
        }
        return out;
    }
}
