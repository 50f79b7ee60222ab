package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.PeriodAnalysisResponse;
import com.bmsedge.analytics.dto.PeriodAnalysisResponse.OverallStats;
import com.bmsedge.analytics.dto.PeriodAnalysisResponse.TrendAnalysis;
import com.bmsedge.analytics.dto.PeriodSummary;
import com.bmsedge.analytics.exception.InsufficientDataException;
import com.bmsedge.analytics.model.Granularity;
import com.bmsedge.analytics.model.SalesDataPoint;
import com.bmsedge.analytics.util.StatisticsMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.*;

/**
 * Summarizes daily sales into days, weeks or months and classifies the trend across them.
 */
@Service
public class PeriodicAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(PeriodicAnalysisService.class);

    public static final String TREND_UP = "upward";
    public static final String TREND_DOWN = "downward";
    public static final String TREND_FLAT = "flat";
    public static final String TREND_INSUFFICIENT = "insufficient data";

    public static final String SEASONALITY_LATER = "later-half increase";
    public static final String SEASONALITY_EARLIER = "earlier-half concentration";
    public static final String SEASONALITY_NONE = "no clear seasonal pattern";

    /**
     * Weekly buckets are counted from the Monday of {@code startDate}; week 1 is the week containing it.
     *
     * @throws InsufficientDataException when there is no data
     */
    public PeriodAnalysisResponse analyzePeriods(String productId, String productName, List<SalesDataPoint> data,
                                                 LocalDate startDate, LocalDate endDate, Granularity granularity) {
        if (data == null || data.isEmpty()) {
            throw new InsufficientDataException("No sales data to summarize for " + productId);
        }
        Granularity effective = granularity == null ? Granularity.WEEKLY : granularity;
        List<SalesDataPoint> sorted = new ArrayList<>(data);
        sorted.sort(Comparator.comparing(SalesDataPoint::getDate));

        List<PeriodSummary> summaries;
        switch (effective) {
            case DAILY:
                summaries = summarizeDaily(sorted);
                break;
            case MONTHLY:
                summaries = summarizeMonthly(sorted);
                break;
            default:
                summaries = summarizeWeekly(sorted, startDate);
        }

        OverallStats stats = calculateOverallStats(summaries);
        TrendAnalysis trends = analyzeTrends(summaries);

        PeriodAnalysisResponse response = new PeriodAnalysisResponse();
        response.setProductId(productId);
        response.setProductName(productName);
        response.setAnalysisPeriod(startDate + " ~ " + endDate);
        response.setGranularity(effective);
        response.setTotalPeriods(summaries.size());
        response.setSummaries(summaries);
        response.setOverallStats(stats);
        response.setTrends(trends);
        response.setRecommendations(generateRecommendations(stats, trends));

        logger.info("Summarized {} points of {} into {} {} periods, trend {}",
                data.size(), productId, summaries.size(), effective.getValue(), trends.getDirection());
        return response;
    }

    List<PeriodSummary> summarizeDaily(List<SalesDataPoint> sorted) {
        List<PeriodSummary> summaries = new ArrayList<>(sorted.size());
        double previous = 0;
        for (int i = 0; i < sorted.size(); i++) {
            SalesDataPoint point = sorted.get(i);
            summaries.add(new PeriodSummary(i + 1, point.getDate(), point.getDate(),
                    point.getSales(), point.getSales(), point.getSales(), point.getSales(), 1,
                    changePercent(point.getSales(), previous), 0, point.temperatureOrZero()));
            previous = point.getSales();
        }
        return summaries;
    }

    List<PeriodSummary> summarizeWeekly(List<SalesDataPoint> sorted, LocalDate startDate) {
        LocalDate anchor = startDate != null ? startDate : sorted.get(0).getDate();
        Map<Integer, List<SalesDataPoint>> groups = new TreeMap<>();
        for (SalesDataPoint point : sorted) {
            groups.computeIfAbsent(weekNumber(point.getDate(), anchor), k -> new ArrayList<>()).add(point);
        }
        List<PeriodSummary> summaries = new ArrayList<>(groups.size());
        double previous = 0;
        for (Map.Entry<Integer, List<SalesDataPoint>> entry : groups.entrySet()) {
            PeriodSummary summary = summarize(entry.getKey() + 1, entry.getValue(), previous);
            summaries.add(summary);
            previous = summary.getTotal();
        }
        return summaries;
    }

    List<PeriodSummary> summarizeMonthly(List<SalesDataPoint> sorted) {
        Map<YearMonth, List<SalesDataPoint>> groups = new TreeMap<>();
        for (SalesDataPoint point : sorted) {
            groups.computeIfAbsent(YearMonth.from(point.getDate()), k -> new ArrayList<>()).add(point);
        }
        List<PeriodSummary> summaries = new ArrayList<>(groups.size());
        double previous = 0;
        int index = 1;
        for (List<SalesDataPoint> month : groups.values()) {
            PeriodSummary summary = summarize(index++, month, previous);
            summaries.add(summary);
            previous = summary.getTotal();
        }
        return summaries;
    }

    /**
     * Zero-based week offset between the Mondays of {@code date} and {@code anchor}, never negative.
     */
    static int weekNumber(LocalDate date, LocalDate anchor) {
        LocalDate anchorMonday = anchor.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate dateMonday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        long weeks = ChronoUnit.DAYS.between(anchorMonday, dateMonday) / 7;
        return (int) Math.max(0, weeks);
    }

    private PeriodSummary summarize(int index, List<SalesDataPoint> points, double previousTotal) {
        double[] sales = points.stream().mapToDouble(SalesDataPoint::getSales).toArray();
        double total = 0;
        double temperature = 0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (SalesDataPoint point : points) {
            total += point.getSales();
            temperature += point.temperatureOrZero();
            min = Math.min(min, point.getSales());
            max = Math.max(max, point.getSales());
        }
        int count = points.size();
        return new PeriodSummary(index, points.get(0).getDate(), points.get(count - 1).getDate(),
                total, total / count, min, max, count,
                changePercent(total, previousTotal), StatisticsMath.stdDev(sales), temperature / count);
    }

    private static double changePercent(double current, double previous) {
        return previous > 0 ? (current - previous) / previous * 100 : 0;
    }

    OverallStats calculateOverallStats(List<PeriodSummary> summaries) {
        OverallStats stats = new OverallStats();
        if (summaries.isEmpty()) {
            return stats;
        }
        double[] totals = summaries.stream().mapToDouble(PeriodSummary::getTotal).toArray();
        double best = -Double.MAX_VALUE;
        double worst = Double.MAX_VALUE;
        for (PeriodSummary summary : summaries) {
            if (summary.getTotal() > best) {
                best = summary.getTotal();
                stats.setBestPeriod(summary.getPeriodIndex());
            }
            if (summary.getTotal() < worst) {
                worst = summary.getTotal();
                stats.setWorstPeriod(summary.getPeriodIndex());
            }
        }
        double average = StatisticsMath.mean(totals);
        double stdDev = StatisticsMath.stdDev(totals);
        stats.setAverageTotal(average);
        stats.setMedianTotal(StatisticsMath.median(totals));
        stats.setStdDevTotal(stdDev);

        double first = totals[0];
        if (totals.length >= 2 && first > 0) {
            stats.setGrowthRate((totals[totals.length - 1] - first) / first * 100);
        }
        if (average > 0) {
            stats.setVolatility(stdDev / average);
        }
        return stats;
    }

    TrendAnalysis analyzeTrends(List<PeriodSummary> summaries) {
        if (summaries.size() < 2) {
            return new TrendAnalysis(TREND_INSUFFICIENT);
        }
        TrendAnalysis trends = new TrendAnalysis();
        double totalGrowth = 0;
        int positive = 0;
        int negative = 0;
        double peak = -Double.MAX_VALUE;
        double low = Double.MAX_VALUE;
        for (int i = 0; i < summaries.size(); i++) {
            PeriodSummary summary = summaries.get(i);
            // the first period has no predecessor to compare against
            if (i > 0) {
                totalGrowth += summary.getChangePercent();
                if (summary.getChangePercent() > 0) {
                    positive++;
                } else if (summary.getChangePercent() < 0) {
                    negative++;
                }
            }
            if (summary.getTotal() > peak) {
                peak = summary.getTotal();
                trends.setPeakPeriod(summary.getPeriodIndex());
            }
            if (summary.getTotal() < low) {
                low = summary.getTotal();
                trends.setLowPeriod(summary.getPeriodIndex());
            }
        }
        double avgGrowth = totalGrowth / (summaries.size() - 1);

        if (avgGrowth > 2) {
            trends.setDirection(TREND_UP);
            trends.setStrength(Math.min(avgGrowth / 10, 1.0));
        } else if (avgGrowth < -2) {
            trends.setDirection(TREND_DOWN);
            trends.setStrength(Math.min(Math.abs(avgGrowth) / 10, 1.0));
        } else {
            trends.setDirection(TREND_FLAT);
            trends.setStrength(1.0 - Math.min(Math.abs(avgGrowth) / 2, 1.0));
        }
        trends.setAverageGrowth(avgGrowth);
        trends.setPositivePeriods(positive);
        trends.setNegativePeriods(negative);
        trends.setSeasonality(detectHalfOverHalfPattern(summaries));
        return trends;
    }

    private static String detectHalfOverHalfPattern(List<PeriodSummary> summaries) {
        if (summaries.size() < 4) {
            return null;
        }
        int mid = summaries.size() / 2;
        double firstHalf = 0;
        double secondHalf = 0;
        for (int i = 0; i < mid; i++) {
            firstHalf += summaries.get(i).getTotal();
        }
        for (int i = mid; i < summaries.size(); i++) {
            secondHalf += summaries.get(i).getTotal();
        }
        firstHalf /= mid;
        secondHalf /= summaries.size() - mid;
        if (firstHalf <= 0) {
            return SEASONALITY_NONE;
        }
        double diff = (secondHalf - firstHalf) / firstHalf * 100;
        if (diff > 15) {
            return SEASONALITY_LATER;
        } else if (diff < -15) {
            return SEASONALITY_EARLIER;
        }
        return SEASONALITY_NONE;
    }

    List<String> generateRecommendations(OverallStats stats, TrendAnalysis trends) {
        List<String> recommendations = new ArrayList<>();
        switch (trends.getDirection()) {
            case TREND_UP:
                recommendations.add(String.format(
                        "Upward trend (average +%.1f%% per period): secure capacity for rising demand",
                        trends.getAverageGrowth()));
                break;
            case TREND_DOWN:
                recommendations.add(String.format(
                        "Downward trend (average %.1f%% per period): optimize stock and strengthen marketing",
                        trends.getAverageGrowth()));
                break;
            case TREND_FLAT:
                recommendations.add("Stable demand: keep the current production plan");
                break;
            default:
                break;
        }

        if (stats.getVolatility() > 0.3) {
            recommendations.add(String.format(
                    "Demand is volatile (coefficient of variation %.2f): hold safety stock", stats.getVolatility()));
        } else if (stats.getVolatility() < 0.15) {
            recommendations.add("Demand is steady: just-in-time replenishment is an option");
        }

        if (stats.getBestPeriod() > 0 && stats.getWorstPeriod() > 0) {
            recommendations.add(String.format(
                    "Period %d had the highest and period %d the lowest demand: plan production around this pattern",
                    stats.getBestPeriod(), stats.getWorstPeriod()));
        }

        if (stats.getGrowthRate() > 20) {
            recommendations.add(String.format(
                    "Grew %.1f%% over the whole range: strengthen supply for the surge", stats.getGrowthRate()));
        } else if (stats.getGrowthRate() < -20) {
            recommendations.add(String.format(
                    "Fell %.1f%% over the whole range: plan measures to recover demand", stats.getGrowthRate()));
        }

        if (trends.getSeasonality() != null && !SEASONALITY_NONE.equals(trends.getSeasonality())) {
            recommendations.add(trends.getSeasonality() + ": factor the seasonal pattern into stock planning");
        }
        return recommendations;
    }
}
