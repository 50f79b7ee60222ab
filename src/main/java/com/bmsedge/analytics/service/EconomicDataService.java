package com.bmsedge.analytics.service;

import com.bmsedge.analytics.config.AnalyticsProperties;
import com.bmsedge.analytics.exception.DataSourceException;
import com.bmsedge.analytics.model.Observation;
import com.bmsedge.analytics.model.ObservationSeries;
import com.bmsedge.analytics.util.DateParsers;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Daily market and economic series (stock index, exchange rate, oil price) loaded from CSV files,
 * one file per symbol.
 */
@Service
public class EconomicDataService {

    private static final Logger logger = LoggerFactory.getLogger(EconomicDataService.class);

    private static final List<String> DATE_HEADERS = List.of("date", "年月日", "日付", "データ日付");
    private static final List<String> VALUE_HEADERS = List.of(
            "adj close", "adj_close", "adjclose", "close", "price", "value", "終値");

    private final String baseDir;
    private final Map<String, String> symbolFiles = new ConcurrentHashMap<>();
    private final Map<String, ObservationSeries> cache = new ConcurrentHashMap<>();

    public EconomicDataService(AnalyticsProperties properties) {
        AnalyticsProperties.Economic economic = properties.getEconomic();
        this.baseDir = economic.getBaseDir() == null ? "" : economic.getBaseDir();
        economic.getSymbolFiles().forEach(this::registerSymbol);
    }

    /**
     * Maps a symbol to a CSV file, replacing any earlier mapping and dropping its cached series.
     */
    public void registerSymbol(String symbol, String filePath) {
        String key = normalizeSymbol(symbol);
        symbolFiles.put(key, filePath);
        cache.remove(key);
    }

    public Set<String> getRegisteredSymbols() {
        return Collections.unmodifiableSet(new TreeSet<>(symbolFiles.keySet()));
    }

    /**
     * Contiguous daily series over [start, end]. Missing days repeat the previous value;
     * days before the first available value are 0.
     *
     * @throws DataSourceException for an unknown symbol, an unreadable file or a range with no data
     */
    public ObservationSeries getMarketSeries(String symbol, LocalDate start, LocalDate end) {
        if (start.isAfter(end)) {
            throw new DataSourceException(String.format("Start date %s is after end date %s", start, end));
        }
        String key = normalizeSymbol(symbol);
        ObservationSeries full = getOrLoad(key);

        Map<LocalDate, Double> inRange = new HashMap<>();
        for (Observation o : full.getObservations()) {
            if (!o.getDate().isBefore(start) && !o.getDate().isAfter(end)) {
                inRange.put(o.getDate(), o.getValue());
            }
        }
        if (inRange.isEmpty()) {
            throw new DataSourceException(String.format("No data for %s between %s and %s", key, start, end));
        }

        List<Observation> daily = new ArrayList<>();
        double last = 0;
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            Double value = inRange.get(d);
            if (value != null) {
                last = value;
            }
            daily.add(new Observation(d, last));
        }
        return ObservationSeries.of(daily);
    }

    /**
     * Day-over-day fractional change of the daily series; 0 where the previous value is 0.
     */
    public ObservationSeries getPctChange(String symbol, LocalDate start, LocalDate end) {
        List<Observation> daily = getMarketSeries(symbol, start, end).getObservations();
        if (daily.size() < 2) {
            return ObservationSeries.empty();
        }
        List<Observation> changes = new ArrayList<>(daily.size() - 1);
        for (int i = 1; i < daily.size(); i++) {
            double previous = daily.get(i - 1).getValue();
            double pct = previous != 0 ? (daily.get(i).getValue() - previous) / previous : 0;
            changes.add(new Observation(daily.get(i).getDate(), pct));
        }
        return ObservationSeries.of(changes);
    }

    private ObservationSeries getOrLoad(String symbol) {
        ObservationSeries cached = cache.get(symbol);
        if (cached != null) {
            return cached;
        }
        String file = symbolFiles.get(symbol);
        if (file == null || file.isBlank()) {
            throw new DataSourceException("No CSV mapping for symbol: " + symbol);
        }
        Path path = Paths.get(file);
        if (!path.isAbsolute() && !baseDir.isBlank()) {
            path = Paths.get(baseDir).resolve(path);
        }
        ObservationSeries series;
        try (InputStream in = Files.newInputStream(path)) {
            series = parseCsv(in);
        } catch (IOException e) {
            throw new DataSourceException("Failed to load CSV for " + symbol + " from " + path, e);
        }
        cache.put(symbol, series);
        logger.info("Loaded {} daily values for {} from {}", series.size(), symbol, path);
        return series;
    }

    /**
     * Parses a CSV with a header row. The date column and the value column are located by name;
     * rows whose date or value cannot be read are skipped and a repeated date keeps the last value.
     *
     * @throws DataSourceException when the header lacks a date or value column or no row is usable
     */
    public ObservationSeries parseCsv(InputStream in) {
        List<String[]> rows;
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReader(reader)) {
            rows = csvReader.readAll();
        } catch (IOException | CsvException e) {
            throw new DataSourceException("Unreadable CSV: " + e.getMessage(), e);
        }
        if (rows.isEmpty()) {
            throw new DataSourceException("CSV has no rows");
        }

        List<String> header = normalizeHeader(rows.get(0));
        int dateIdx = indexOfAny(header, DATE_HEADERS);
        if (dateIdx < 0) {
            throw new DataSourceException("CSV date column not found in " + header);
        }
        int valueIdx = -1;
        for (String name : VALUE_HEADERS) {
            valueIdx = header.indexOf(name);
            if (valueIdx >= 0) {
                break;
            }
        }
        if (valueIdx < 0) {
            for (int i = 0; i < header.size(); i++) {
                String h = header.get(i);
                if (h.contains("close") || h.contains("price") || h.contains("終値")) {
                    valueIdx = i;
                    break;
                }
            }
        }
        if (valueIdx < 0) {
            throw new DataSourceException("CSV value column (Close/Adj Close/Price/Value/終値) not found in " + header);
        }

        // TreeMap keeps dates ascending; put() lets the last duplicate win
        Map<LocalDate, Double> values = new TreeMap<>();
        int skipped = 0;
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (row.length <= dateIdx || row.length <= valueIdx) {
                skipped++;
                continue;
            }
            Optional<LocalDate> date = DateParsers.parse(row[dateIdx], DateParsers.MARKET_DATA_LAYOUTS);
            OptionalDouble value = parseNumber(row[valueIdx]);
            if (date.isEmpty() || value.isEmpty()) {
                skipped++;
                continue;
            }
            values.put(date.get(), value.getAsDouble());
        }
        if (values.isEmpty()) {
            throw new DataSourceException("CSV has no valid rows");
        }
        if (skipped > 0) {
            logger.debug("Skipped {} unreadable CSV rows", skipped);
        }
        List<Observation> observations = new ArrayList<>(values.size());
        values.forEach((d, v) -> observations.add(new Observation(d, v)));
        return ObservationSeries.of(observations);
    }

    /**
     * Keeps digits, '.' and '-' so that values like "35,000円" read as 35000.
     */
    static OptionalDouble parseNumber(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        StringBuilder sb = new StringBuilder();
        for (char c : raw.trim().toCharArray()) {
            if ((c >= '0' && c <= '9') || c == '.' || c == '-') {
                sb.append(c);
            }
        }
        if (sb.length() == 0) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(sb.toString()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static List<String> normalizeHeader(String[] header) {
        List<String> out = new ArrayList<>(header.length);
        for (String h : header) {
            String v = h == null ? "" : h;
            if (v.startsWith("\uFEFF")) {
                v = v.substring(1);
            }
            out.add(v.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private static int indexOfAny(List<String> header, List<String> candidates) {
        for (int i = 0; i < header.size(); i++) {
            if (candidates.contains(header.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static String normalizeSymbol(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
    }
}
