package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.CorrelationResult;
import com.bmsedge.analytics.dto.WindowedLagResult;
import com.bmsedge.analytics.exception.DegenerateInputException;
import com.bmsedge.analytics.exception.ErrorKind;
import com.bmsedge.analytics.exception.InsufficientDataException;
import com.bmsedge.analytics.exception.InvalidParameterException;
import com.bmsedge.analytics.model.ObservationSeries;
import com.bmsedge.analytics.util.StatisticsMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Pearson correlation with significance testing, plus lag scans between two dated series.
 */
@Service
public class CorrelationService {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationService.class);

    public static final int MIN_ALIGNED_POINTS = 5;
    public static final int MIN_WINDOW_DAYS = 7;
    public static final int TOP_RESULTS = 3;
    public static final double SIGNIFICANCE_LEVEL = 0.05;

    /**
     * Pearson product-moment correlation coefficient.
     *
     * @throws DegenerateInputException when the inputs are empty, differ in length or either has zero variance
     */
    public double pearson(double[] x, double[] y) {
        if (x.length != y.length || x.length == 0) {
            throw new DegenerateInputException(String.format(
                    "Series must be non-empty and of equal length (x=%d, y=%d)", x.length, y.length));
        }
        double meanX = StatisticsMath.mean(x);
        double meanY = StatisticsMath.mean(y);
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        double denominator = Math.sqrt(sxx * syy);
        if (denominator == 0) {
            throw new DegenerateInputException("Zero variance in at least one series");
        }
        double r = sxy / denominator;
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Two-tailed p-value of a correlation coefficient from n paired samples.
     */
    public double pValue(double r, int n) {
        if (n < 3) {
            return 1.0;
        }
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        double t = r * Math.sqrt(n - 2) / Math.sqrt(1 - r * r);
        double p = 2 * (1 - StatisticsMath.studentTCdf(Math.abs(t), n - 2));
        return Math.max(0.0, Math.min(1.0, p));
    }

    public String interpret(double r, double pValue) {
        double absR = Math.abs(r);
        String strength;
        if (absR >= 0.7) {
            strength = "strong";
        } else if (absR >= 0.4) {
            strength = "moderate";
        } else if (absR >= 0.2) {
            strength = "weak";
        } else {
            strength = "negligible";
        }
        String direction = r < 0 ? "negative" : "positive";
        String significance = pValue < SIGNIFICANCE_LEVEL
                ? "(statistically significant)"
                : "(not statistically significant)";
        return String.format("%s %s correlation %s", strength, direction, significance);
    }

    /**
     * Correlates two equal-length arrays and packages the outcome.
     */
    public CorrelationResult correlate(String label, double[] x, double[] y) {
        double r = pearson(x, y);
        double p = pValue(r, x.length);
        return new CorrelationResult(label, r, p, x.length, interpret(r, p), 0);
    }

    public static String lagLabel(int lag) {
        if (lag > 0) {
            return "y lags x by " + lag + " days";
        } else if (lag < 0) {
            return "y leads x by " + (-lag) + " days";
        }
        return "lag=0";
    }

    public List<CorrelationResult> laggedCorrelation(ObservationSeries x, ObservationSeries y, int maxLagDays) {
        return laggedCorrelation(x.dates(), x.values(), y.dates(), y.values(), maxLagDays);
    }

    /**
     * Correlates x(t) with y(t + lag) for every lag in [-maxLagDays, maxLagDays].
     * Lags with fewer than five aligned dates are skipped.
     *
     * @return one result per usable lag, strongest |r| first
     */
    public List<CorrelationResult> laggedCorrelation(List<LocalDate> xDates, double[] xValues,
                                                     List<LocalDate> yDates, double[] yValues,
                                                     int maxLagDays) {
        checkLengths(xDates, xValues, yDates, yValues);
        if (xValues.length < MIN_ALIGNED_POINTS || yValues.length < MIN_ALIGNED_POINTS) {
            throw new InsufficientDataException(String.format(
                    "At least %d points are needed in each series (x=%d, y=%d)",
                    MIN_ALIGNED_POINTS, xValues.length, yValues.length), ErrorKind.INSUFFICIENT_SAMPLES);
        }
        if (maxLagDays < 0) {
            throw new InvalidParameterException("maxLagDays must not be negative: " + maxLagDays);
        }
        Map<LocalDate, Double> xMap = toMap(xDates, xValues);
        Map<LocalDate, Double> yMap = toMap(yDates, yValues);

        List<CorrelationResult> results = new ArrayList<>();
        for (int lag = -maxLagDays; lag <= maxLagDays; lag++) {
            CorrelationResult result = correlateAtLag(xDates, xMap, yMap, lag);
            if (result != null) {
                results.add(result);
            }
        }
        results.sort(Comparator.comparingDouble(CorrelationResult::getAbsoluteCoefficient).reversed());
        logger.debug("Lag scan over +/-{} days produced {} usable lags", maxLagDays, results.size());
        return results;
    }

    private CorrelationResult correlateAtLag(Collection<LocalDate> xDates, Map<LocalDate, Double> xMap,
                                             Map<LocalDate, Double> yMap, int lag) {
        double[][] aligned = align(xDates, xMap, yMap, lag);
        if (aligned[0].length < MIN_ALIGNED_POINTS) {
            return null;
        }
        try {
            double r = pearson(aligned[0], aligned[1]);
            double p = pValue(r, aligned[0].length);
            return new CorrelationResult(lagLabel(lag), r, p, aligned[0].length, interpret(r, p), lag);
        } catch (DegenerateInputException e) {
            logger.debug("Skipping lag {}: {}", lag, e.getMessage());
            return null;
        }
    }

    /**
     * Slides a window of windowDays across the x timeline and reports the strongest lag in each.
     * The next window starts at the first x date on or after windowStart + stepDays, so with
     * gaps in the dates the effective step can be longer than stepDays.
     *
     * @throws InvalidParameterException when windowDays is below 7 or stepDays is not positive
     */
    public List<WindowedLagResult> windowedLaggedCorrelation(List<LocalDate> xDates, double[] xValues,
                                                             List<LocalDate> yDates, double[] yValues,
                                                             int maxLagDays, int windowDays, int stepDays) {
        checkLengths(xDates, xValues, yDates, yValues);
        if (windowDays < MIN_WINDOW_DAYS) {
            throw new InvalidParameterException(String.format(
                    "windowDays must be at least %d, got %d", MIN_WINDOW_DAYS, windowDays));
        }
        if (stepDays < 1) {
            throw new InvalidParameterException("stepDays must be positive, got " + stepDays);
        }
        if (xDates.isEmpty()) {
            throw new InsufficientDataException("x series has no dates");
        }
        Map<LocalDate, Double> xMap = toMap(xDates, xValues);
        Map<LocalDate, Double> yMap = toMap(yDates, yValues);
        List<LocalDate> times = new ArrayList<>(new TreeSet<>(xDates));

        List<WindowedLagResult> results = new ArrayList<>();
        int startIdx = 0;
        while (true) {
            LocalDate windowStart = times.get(startIdx);
            LocalDate windowEnd = windowStart.plusDays(windowDays - 1L);
            List<LocalDate> windowDates = times.stream()
                    .filter(t -> !t.isBefore(windowStart) && !t.isAfter(windowEnd))
                    .collect(Collectors.toList());
            if (windowDates.size() < MIN_ALIGNED_POINTS) {
                break;
            }

            List<CorrelationResult> lags = new ArrayList<>();
            for (int lag = -maxLagDays; lag <= maxLagDays; lag++) {
                CorrelationResult result = correlateAtLag(windowDates, xMap, yMap, lag);
                if (result != null) {
                    lags.add(result);
                }
            }
            if (!lags.isEmpty()) {
                double[] rawP = lags.stream().mapToDouble(CorrelationResult::getPValue).toArray();
                double[] adjusted = StatisticsMath.benjaminiHochberg(rawP);
                int best = 0;
                for (int i = 1; i < lags.size(); i++) {
                    if (lags.get(i).getAbsoluteCoefficient() > lags.get(best).getAbsoluteCoefficient()) {
                        best = i;
                    }
                }
                CorrelationResult top = lags.get(best);
                results.add(new WindowedLagResult(windowStart, windowEnd, top.getLagDays(), top.getCoefficient(),
                        top.getPValue(), adjusted[best], top.getSampleSize()));
            }

            LocalDate nextStart = windowStart.plusDays(stepDays);
            int nextIdx = -1;
            for (int i = 0; i < times.size(); i++) {
                if (!times.get(i).isBefore(nextStart)) {
                    nextIdx = i;
                    break;
                }
            }
            if (nextIdx == -1 || nextIdx == startIdx) {
                break;
            }
            startIdx = nextIdx;
        }
        logger.debug("Windowed lag scan produced {} windows", results.size());
        return results;
    }

    /**
     * @return at most {@code limit} results, strongest |r| first
     */
    public static List<CorrelationResult> topByMagnitude(List<CorrelationResult> results, int limit) {
        return results.stream()
                .sorted(Comparator.comparingDouble(CorrelationResult::getAbsoluteCoefficient).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static double[][] align(Collection<LocalDate> xDates, Map<LocalDate, Double> xMap,
                                    Map<LocalDate, Double> yMap, int lag) {
        List<Double> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        for (LocalDate d : xDates) {
            Double xv = xMap.get(d);
            Double yv = yMap.get(d.plusDays(lag));
            if (xv != null && yv != null) {
                xs.add(xv);
                ys.add(yv);
            }
        }
        return new double[][]{
                xs.stream().mapToDouble(Double::doubleValue).toArray(),
                ys.stream().mapToDouble(Double::doubleValue).toArray()
        };
    }

    private static Map<LocalDate, Double> toMap(List<LocalDate> dates, double[] values) {
        Map<LocalDate, Double> map = new HashMap<>(dates.size() * 2);
        for (int i = 0; i < values.length; i++) {
            map.put(dates.get(i), values[i]);
        }
        return map;
    }

    private static void checkLengths(List<LocalDate> xDates, double[] xValues,
                                     List<LocalDate> yDates, double[] yValues) {
        if (xDates.size() != xValues.length || yDates.size() != yValues.length) {
            throw new InvalidParameterException(String.format(
                    "Dates and values differ in length (x: %d/%d, y: %d/%d)",
                    xDates.size(), xValues.length, yDates.size(), yValues.length));
        }
    }
}
