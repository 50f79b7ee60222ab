package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.AnomalyRecord;
import com.bmsedge.analytics.exception.InvalidParameterException;
import com.bmsedge.analytics.model.AnomalyDirection;
import com.bmsedge.analytics.model.Granularity;
import com.bmsedge.analytics.model.Observation;
import com.bmsedge.analytics.model.ObservationSeries;
import com.bmsedge.analytics.model.Severity;
import com.bmsedge.analytics.util.StatisticsMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.*;

/**
 * Flags periods whose value deviates from the moving average of the preceding periods
 * by more than the granularity's threshold.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    /**
     * Bucketed totals, in the order each bucket was first seen.
     */
    public static final class AggregatedSeries {
        private final List<String> keys;
        private final double[] values;

        AggregatedSeries(List<String> keys, double[] values) {
            this.keys = Collections.unmodifiableList(keys);
            this.values = values;
        }

        public List<String> getKeys() {
            return keys;
        }

        public double[] getValues() {
            return values.clone();
        }

        public int size() {
            return values.length;
        }
    }

    public static String periodKey(LocalDate date, Granularity granularity) {
        switch (granularity) {
            case WEEKLY:
                return String.format("%d-W%02d",
                        date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTHLY:
                return date.format(MONTH_KEY);
            default:
                return date.toString();
        }
    }

    /**
     * Sums the series into ISO weeks or calendar months. Daily granularity keeps one bucket per date.
     * The input is left untouched.
     */
    public AggregatedSeries aggregate(ObservationSeries series, Granularity granularity) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (Observation o : series.getObservations()) {
            totals.merge(periodKey(o.getDate(), granularity), o.getValue(), Double::sum);
        }
        double[] values = new double[totals.size()];
        int i = 0;
        for (double v : totals.values()) {
            values[i++] = v;
        }
        return new AggregatedSeries(new ArrayList<>(totals.keySet()), values);
    }

    public List<AnomalyRecord> detectAnomalies(ObservationSeries series, String productId, String productName) {
        return detectAnomalies(series, productId, productName, Granularity.WEEKLY);
    }

    /**
     * @return anomalies in chronological order; empty when there are fewer buckets than the window
     */
    public List<AnomalyRecord> detectAnomalies(ObservationSeries series, String productId, String productName,
                                               Granularity granularity) {
        String displayName = productName == null || productName.isBlank() ? productId : productName;
        AggregatedSeries aggregated = aggregate(series, granularity);
        logger.debug("[{}] aggregated {} observations into {} {} buckets",
                displayName, series.size(), aggregated.size(), granularity.getValue());
        return scan(aggregated.getKeys(), aggregated.getValues(), productId, productName, granularity);
    }

    /**
     * Scans already-bucketed values with the policy of the given granularity.
     *
     * @throws InvalidParameterException when keys and values differ in length
     */
    public List<AnomalyRecord> scan(List<String> keys, double[] values, String productId, String productName,
                                    Granularity granularity) {
        if (keys.size() != values.length) {
            throw new InvalidParameterException(String.format(
                    "%d period keys for %d values", keys.size(), values.length));
        }
        int window = granularity.getMovingAverageWindow();
        double threshold = granularity.getDeviationThreshold();
        if (values.length < window) {
            logger.info("Not enough history for {} anomaly detection on {} ({} < {})",
                    granularity.getValue(), productId, values.length, window);
            return Collections.emptyList();
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (int i = window; i < values.length; i++) {
            double[] preceding = Arrays.copyOfRange(values, i - window, i);
            double movingAverage = StatisticsMath.mean(preceding);
            double current = values[i];
            double deviation = current - movingAverage;

            if (movingAverage > 0 && Math.abs(deviation) > movingAverage * threshold) {
                double stdDev = StatisticsMath.stdDev(preceding);
                double zScore = stdDev > 0 ? deviation / stdDev : 0;
                anomalies.add(new AnomalyRecord(keys.get(i), productId, productName,
                        current, movingAverage, Math.abs(deviation), zScore,
                        deviation > 0 ? AnomalyDirection.INCREASE : AnomalyDirection.DECREASE,
                        Severity.fromAbsoluteZScore(Math.abs(zScore))));
            }
        }
        logger.info("Detected {} {} anomalies for {}", anomalies.size(), granularity.getValue(), productId);
        return anomalies;
    }
}
