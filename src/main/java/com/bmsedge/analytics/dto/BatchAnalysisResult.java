package com.bmsedge.analytics.dto;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Setter
@Getter
public class BatchAnalysisResult {
    private int totalProducts;
    private int successCount;
    private int noDataCount;
    private int failCount;
    private long durationMs;
    private List<String> errors = new ArrayList<>();
    private Map<String, AnalysisReport> reports = new LinkedHashMap<>();

    public BatchAnalysisResult() {}
}
