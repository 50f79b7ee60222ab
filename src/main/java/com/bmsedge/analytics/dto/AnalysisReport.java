package com.bmsedge.analytics.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Combined correlation, regression and summary report for one product.
 */
@Setter
@Getter
public class AnalysisReport {
    private String reportId;
    private String productId;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime analysisDate;

    private int dataPoints;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    private int weatherMatches;
    private StatisticalSummary summary;
    private List<CorrelationResult> correlations = new ArrayList<>();
    // null when fewer than two sales dates matched a weather reading
    private RegressionModel regression;
    private List<String> recommendations = new ArrayList<>();

    public AnalysisReport() {
        this.analysisDate = LocalDateTime.now();
    }

    public String getDateRange() {
        return startDate + " ~ " + endDate;
    }
}
