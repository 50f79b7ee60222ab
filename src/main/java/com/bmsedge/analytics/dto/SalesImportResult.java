package com.bmsedge.analytics.dto;

import com.bmsedge.analytics.model.ObservationSeries;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Setter
@Getter
public class SalesImportResult {
    private String fileName;
    // product id -> daily sales, one value per date
    private Map<String, ObservationSeries> seriesByProduct = new LinkedHashMap<>();
    private Map<String, String> productNames = new LinkedHashMap<>();
    private int rowsRead;
    private int rowsSkipped;
    // first few row-level problems, for display
    private List<String> parseErrors = new ArrayList<>();

    public SalesImportResult() {}

    public int getProductCount() {
        return seriesByProduct.size();
    }
}
