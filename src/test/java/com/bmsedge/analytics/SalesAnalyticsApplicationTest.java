package com.bmsedge.analytics;

import com.bmsedge.analytics.config.AnalyticsProperties;
import com.bmsedge.analytics.dto.AnalysisReport;
import com.bmsedge.analytics.dto.AnomalyQuestion;
import com.bmsedge.analytics.dto.AnomalyRecord;
import com.bmsedge.analytics.dto.BatchAnalysisResult;
import com.bmsedge.analytics.dto.SalesImportResult;
import com.bmsedge.analytics.model.Granularity;
import com.bmsedge.analytics.service.AnomalyDetectionService;
import com.bmsedge.analytics.service.AnomalyQuestionService;
import com.bmsedge.analytics.service.SalesAnalysisService;
import com.bmsedge.analytics.service.SalesDataImportService;
import com.bmsedge.analytics.service.WeatherCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class SalesAnalyticsApplicationTest {

    @Autowired
    private AnalyticsProperties properties;

    @Autowired
    private SalesDataImportService salesDataImportService;

    @Autowired
    private SalesAnalysisService salesAnalysisService;

    @Autowired
    private AnomalyDetectionService anomalyDetectionService;

    @Autowired
    private AnomalyQuestionService anomalyQuestionService;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private WeatherCache weatherCache;

    @Test
    @DisplayName("Should bind the analytics properties")
    void testPropertiesBound() {
        assertEquals("130000", properties.getWeather().getDefaultRegion());
        assertEquals(List.of("NIKKEI", "USDJPY", "WTI"), properties.getEconomic().getSymbols());
        assertEquals(2, properties.getBatch().getPoolSize());
        assertEquals(30, properties.getBatch().getTimeoutSeconds());
        assertEquals(64, properties.getWeather().getCacheMaxEntries());
        assertEquals(64, weatherCache.getMaxEntries());
    }

    @Test
    @DisplayName("Should import sales, detect a spike and analyze every product")
    void testImportAnalyzeAndDetect() throws Exception {
        // Arrange: six weeks of daily sales for two products, the last week of P001 spikes
        StringBuilder csv = new StringBuilder("date,product_id,product_name,sales\n");
        LocalDate start = LocalDate.of(2024, 6, 3);
        for (int day = 0; day < 42; day++) {
            LocalDate date = start.plusDays(day);
            double cola = day >= 35 ? 400 : 100 + (day % 7) * 5;
            csv.append(date).append(",P001,Cola,").append(cola).append('\n');
            csv.append(date).append(",P002,Tea,").append(50 + day % 3).append('\n');
        }

        // Act
        SalesImportResult imported = salesDataImportService.importFile("sales.csv",
                new ByteArrayInputStream(csv.toString().getBytes(StandardCharsets.UTF_8)));
        List<AnomalyRecord> anomalies = anomalyDetectionService.detectAnomalies(
                imported.getSeriesByProduct().get("P001"), "P001", "Cola", Granularity.WEEKLY);
        BatchAnalysisResult batch = salesAnalysisService.analyzeProducts(imported.getSeriesByProduct(), null);

        // Assert
        assertEquals(2, imported.getProductCount());
        assertEquals(1, anomalies.size());
        AnomalyQuestion question = anomalyQuestionService.generateQuestion(anomalies.get(0));
        assertFalse(question.isGenerated());
        assertTrue(question.getQuestion().contains("Cola"));

        assertEquals(2, batch.getSuccessCount());
        assertEquals(0, batch.getFailCount());
        AnalysisReport report = batch.getReports().get("P001");
        assertEquals(42, report.getDataPoints());
        assertEquals(42, report.getWeatherMatches());
        assertNotNull(report.getRegression());
        assertFalse(report.getRecommendations().isEmpty());

        String json = objectMapper.writeValueAsString(report);
        assertTrue(json.contains("\"startDate\":\"2024-06-03\""));
    }
}
