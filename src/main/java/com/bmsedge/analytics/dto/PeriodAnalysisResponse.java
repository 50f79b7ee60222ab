package com.bmsedge.analytics.dto;

import com.bmsedge.analytics.model.Granularity;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.List;

@Setter
@Getter
public class PeriodAnalysisResponse {
    private String productId;
    private String productName;
    private String analysisPeriod;
    private Granularity granularity;
    private int totalPeriods;
    private List<PeriodSummary> summaries;
    private OverallStats overallStats;
    private TrendAnalysis trends;
    private List<String> recommendations;
    private LocalDateTime generatedAt;

    public PeriodAnalysisResponse() {
        this.generatedAt = LocalDateTime.now();
    }

    // Statistics across the period totals
    @Setter
    @Getter
    public static class OverallStats {
        private double averageTotal;
        private double medianTotal;
        private double stdDevTotal;
        // 1-based period indexes, 0 when there are no periods
        private int bestPeriod;
        private int worstPeriod;
        private double growthRate;
        private double volatility;

        public OverallStats() {}
    }

    @Setter
    @Getter
    public static class TrendAnalysis {
        private String direction;
        private double strength;
        // null when fewer than four periods were summarized
        private String seasonality;
        private int peakPeriod;
        private int lowPeriod;
        private int positivePeriods;
        private int negativePeriods;
        private double averageGrowth;

        public TrendAnalysis() {}

        public TrendAnalysis(String direction) {
            this.direction = direction;
        }
    }
}
