package com.bmsedge.analytics.service;

import com.bmsedge.analytics.config.AnalyticsProperties;
import com.bmsedge.analytics.dto.AnalysisReport;
import com.bmsedge.analytics.dto.BatchAnalysisResult;
import com.bmsedge.analytics.dto.CorrelationResult;
import com.bmsedge.analytics.dto.RegressionModel;
import com.bmsedge.analytics.dto.StatisticalSummary;
import com.bmsedge.analytics.exception.DataSourceException;
import com.bmsedge.analytics.exception.InsufficientDataException;
import com.bmsedge.analytics.model.ObservationSeries;
import com.bmsedge.analytics.model.WeatherObservation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SalesAnalysisService
 */
class SalesAnalysisServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 7, 1);

    @Mock
    private ExternalFactorCorrelationService externalFactorCorrelationService;

    @Mock
    private WeatherDataService weatherDataService;

    @Spy
    private RegressionService regressionService;

    @Spy
    private AnalyticsProperties properties = new AnalyticsProperties();

    @InjectMocks
    private SalesAnalysisService salesAnalysisService;

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setThreadNamePrefix("analysis-test-");
        executor.initialize();
        ReflectionTestUtils.setField(salesAnalysisService, "analysisExecutor", executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Should summarize a sales series")
    void testStatisticalSummary() {
        ObservationSeries sales = series(3, 1, 4, 1, 5);

        StatisticalSummary summary = salesAnalysisService.generateStatisticalSummary(sales);

        assertEquals(5, summary.getCount());
        assertEquals(2.8, summary.getMean(), 1e-12);
        assertEquals(3.0, summary.getMedian());
        assertEquals(1.0, summary.getMin());
        assertEquals(5.0, summary.getMax());
        assertEquals(14.0, summary.getTotal());
        assertTrue(summary.describe().contains("Data points: 5"));
        assertThrows(InsufficientDataException.class,
                () -> salesAnalysisService.generateStatisticalSummary(ObservationSeries.empty()));
    }

    @Test
    @DisplayName("Should build a report with correlations, regression and recommendations")
    void testCreateAnalysisReport() {
        // Arrange
        ObservationSeries sales = series(120, 150, 180, 210, 240, 270);
        CorrelationResult temperature = new CorrelationResult("temperature_lag=0", 0.8, 0.001, 6,
                "strong positive correlation (statistically significant)", 0);
        CorrelationResult lagged = new CorrelationResult("temperature_y lags x by 2 days", 0.6, 0.01, 6,
                "moderate positive correlation (statistically significant)", 2);
        when(externalFactorCorrelationService.analyzeSalesWeatherCorrelation(sales, "130000"))
                .thenReturn(List.of(temperature, lagged));
        when(externalFactorCorrelationService.analyzeSalesEconomicCorrelation(eq(sales), isNull(), eq(0)))
                .thenThrow(new DataSourceException("No CSV mapping for symbol: NIKKEI"));
        when(weatherDataService.getHistoricalWeather("130000", START, START.plusDays(5)))
                .thenReturn(weather(20, 22, 24, 26, 28, 30));

        // Act
        AnalysisReport report = salesAnalysisService.createAnalysisReport("P001", sales, null);

        // Assert
        assertNotNull(report.getReportId());
        assertEquals("P001", report.getProductId());
        assertEquals(6, report.getDataPoints());
        assertEquals(6, report.getWeatherMatches());
        assertEquals("2024-07-01 ~ 2024-07-06", report.getDateRange());
        assertEquals(2, report.getCorrelations().size());

        RegressionModel regression = report.getRegression();
        assertNotNull(regression);
        assertEquals(15.0, regression.getSlope(), 1e-9);
        assertEquals(1.0, regression.getRSquared(), 1e-9);

        List<String> recommendations = report.getRecommendations();
        assertTrue(recommendations.contains("Sales rise with temperature. Build up stock for the summer season."));
        assertTrue(recommendations.stream().anyMatch(r -> r.startsWith("Time lag detected: temperature_y lags x by 2 days")));
        assertTrue(recommendations.stream().anyMatch(r -> r.startsWith("The temperature model explains 100.0%")));
    }

    @Test
    @DisplayName("Should explain a report without correlations or weather")
    void testCreateAnalysisReportWithoutMatches() {
        ObservationSeries sales = series(10, 12, 11);
        when(externalFactorCorrelationService.analyzeSalesWeatherCorrelation(any(), anyString()))
                .thenThrow(new InsufficientDataException("too short"));
        when(externalFactorCorrelationService.analyzeSalesEconomicCorrelation(any(), any(), anyInt()))
                .thenReturn(List.of());
        when(weatherDataService.getHistoricalWeather(anyString(), any(), any())).thenReturn(List.of());

        AnalysisReport report = salesAnalysisService.createAnalysisReport("P002", sales, "270000");

        assertNull(report.getRegression());
        assertEquals(0, report.getWeatherMatches());
        assertTrue(report.getCorrelations().isEmpty());
        assertTrue(report.getRecommendations().get(0).startsWith("Sales dates did not match any external data"));
        verify(regressionService, never()).linearRegression(any(), any());
    }

    @Test
    @DisplayName("Should recommend more data when nothing stands out")
    void testDefaultRecommendations() {
        CorrelationResult weak = new CorrelationResult("humidity_lag=0", 0.35, 0.2, 10,
                "weak positive correlation (not statistically significant)", 0);

        List<String> recommendations = salesAnalysisService.generateRecommendations(List.of(weak), null);

        assertEquals(2, recommendations.size());
        assertEquals("More data will allow a more precise analysis.", recommendations.get(0));
    }

    @Test
    @DisplayName("Should recommend per economic indicator")
    void testEconomicRecommendations() {
        List<CorrelationResult> correlations = List.of(
                new CorrelationResult("NIKKEI_lag=0", -0.7, 0.001, 30, "", 0),
                new CorrelationResult("USDJPY_lag=0", 0.6, 0.01, 30, "", 0),
                new CorrelationResult("WTI_lag=0", 0.55, 0.02, 30, "", 0));

        List<String> recommendations = salesAnalysisService.generateRecommendations(correlations, null);

        assertEquals(3, recommendations.size());
        assertTrue(recommendations.get(0).startsWith("Negative correlation with the Nikkei index (r = -0.70)"));
        assertTrue(recommendations.get(1).contains("USD/JPY"));
        assertTrue(recommendations.get(2).contains("crude oil"));
    }

    @Test
    @DisplayName("Should analyze products in parallel and count successes, empty series and failures")
    void testAnalyzeProducts() {
        // Arrange
        ObservationSeries good = series(10, 20, 30);
        ObservationSeries broken = series(99, 98, 97);
        when(externalFactorCorrelationService.analyzeSalesWeatherCorrelation(eq(good), anyString()))
                .thenReturn(new ArrayList<>());
        when(externalFactorCorrelationService.analyzeSalesWeatherCorrelation(eq(broken), anyString()))
                .thenThrow(new IllegalStateException("weather backend unavailable"));
        when(externalFactorCorrelationService.analyzeSalesEconomicCorrelation(any(), any(), anyInt()))
                .thenReturn(new ArrayList<>());
        when(weatherDataService.getHistoricalWeather(anyString(), any(), any())).thenReturn(List.of());

        Map<String, ObservationSeries> products = new LinkedHashMap<>();
        products.put("P001", good);
        products.put("P002", ObservationSeries.empty());
        products.put("P003", broken);

        // Act
        BatchAnalysisResult result = salesAnalysisService.analyzeProducts(products, "130000");

        // Assert
        assertEquals(3, result.getTotalProducts());
        assertEquals(1, result.getSuccessCount());
        assertEquals(1, result.getNoDataCount());
        assertEquals(1, result.getFailCount());
        assertEquals(List.of("Product P003: weather backend unavailable"), result.getErrors());
        assertTrue(result.getReports().containsKey("P001"));
        assertFalse(result.getReports().containsKey("P003"));
        assertTrue(result.getDurationMs() >= 0);
    }

    private static ObservationSeries series(double... values) {
        List<LocalDate> dates = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            dates.add(START.plusDays(i));
        }
        return ObservationSeries.of(dates, values);
    }

    private static List<WeatherObservation> weather(double... temperatures) {
        List<WeatherObservation> readings = new ArrayList<>();
        for (int i = 0; i < temperatures.length; i++) {
            readings.add(new WeatherObservation(START.plusDays(i), "130000", "Tokyo", temperatures[i],
                    temperatures[i] + 5, temperatures[i] - 5, 65, 3, "test"));
        }
        return readings;
    }
}
