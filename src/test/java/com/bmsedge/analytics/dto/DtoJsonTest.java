package com.bmsedge.analytics.dto;

import com.bmsedge.analytics.model.AnomalyDirection;
import com.bmsedge.analytics.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON field names of the statistical result objects.
 */
class DtoJsonTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Test
    @DisplayName("Should write pValue for a correlation result")
    void testCorrelationResultFieldNames() {
        CorrelationResult result = new CorrelationResult("lag_0", 0.8, 0.01, 12, "strong positive", 0);

        JsonNode json = objectMapper.valueToTree(result);

        assertEquals(0.01, json.get("pValue").asDouble());
        assertFalse(json.has("pvalue"));
        assertEquals(0.8, json.get("coefficient").asDouble());
    }

    @Test
    @DisplayName("Should write zScore for an anomaly record")
    void testAnomalyRecordFieldNames() {
        AnomalyRecord record = new AnomalyRecord("2024-W05", "P001", "Tea", 150, 100, 50, 2.5,
                AnomalyDirection.INCREASE, Severity.HIGH);

        JsonNode json = objectMapper.valueToTree(record);

        assertEquals(2.5, json.get("zScore").asDouble());
        assertFalse(json.has("zscore"));
    }

    @Test
    @DisplayName("Should keep camel case for the other single-letter prefixed statistics")
    void testStatisticFieldNames() {
        JsonNode granger = objectMapper.valueToTree(new GrangerResult(4.2, 0.03, 2, 50));
        JsonNode regression = objectMapper.valueToTree(new RegressionModel(2, 1, 0.9, 21, "y = 2.00x + 1.00"));
        JsonNode window = objectMapper.valueToTree(new WindowedLagResult(
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 14), 1, 0.7, 0.02, 0.04, 13));

        assertEquals(4.2, granger.get("fStatistic").asDouble());
        assertEquals(0.03, granger.get("pValue").asDouble());
        assertFalse(granger.has("fstatistic"));
        assertFalse(granger.has("pvalue"));
        assertEquals(0.9, regression.get("rSquared").asDouble());
        assertFalse(regression.has("rsquared"));
        assertEquals(0.02, window.get("pValue").asDouble());
        assertEquals(0.04, window.get("adjustedPValue").asDouble());
        assertFalse(window.has("pvalue"));
    }
}
