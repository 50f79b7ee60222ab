package com.bmsedge.analytics.service;

import com.bmsedge.analytics.dto.SalesImportResult;
import com.bmsedge.analytics.exception.DataSourceException;
import com.bmsedge.analytics.model.Observation;
import com.bmsedge.analytics.model.ObservationSeries;
import com.bmsedge.analytics.util.DateParsers;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.*;

/**
 * Reads per-product daily sales from CSV or Excel files with a header row.
 */
@Service
public class SalesDataImportService {

    private static final Logger logger = LoggerFactory.getLogger(SalesDataImportService.class);

    static final int MAX_REPORTED_ERRORS = 20;

    static final List<String> DATE_HEADERS = List.of("date", "日付");
    static final List<String> PRODUCT_ID_HEADERS = List.of(
            "製品ID", "製品コード", "商品ID", "商品コード", "product_code", "product_id");
    static final List<String> PRODUCT_NAME_HEADERS = List.of(
            "製品名", "製品", "商品名", "商品", "product", "product_name");
    static final List<String> SALES_HEADERS = List.of("sales", "quantity", "販売数", "数量");

    /**
     * @throws DataSourceException for an unsupported extension, an unreadable file or a missing required column
     */
    public SalesImportResult importFile(String fileName, InputStream in) {
        if (fileName == null || fileName.isBlank()) {
            throw new DataSourceException("File name cannot be empty");
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        List<String[]> rows;
        if (lower.endsWith(".csv")) {
            rows = readCsv(in);
        } else if (lower.endsWith(".xlsx")) {
            rows = readXlsx(in);
        } else {
            throw new DataSourceException("Unsupported file format: " + fileName + ". Upload a .csv or .xlsx file.");
        }
        SalesImportResult result = parseRows(rows);
        result.setFileName(fileName);
        logger.info("Imported {}: {} rows read, {} skipped, {} products",
                fileName, result.getRowsRead(), result.getRowsSkipped(), result.getProductCount());
        return result;
    }

    List<String[]> readCsv(InputStream in) {
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReader(reader)) {
            return csvReader.readAll();
        } catch (IOException | CsvException e) {
            throw new DataSourceException("Error reading CSV: " + e.getMessage(), e);
        }
    }

    List<String[]> readXlsx(InputStream in) {
        List<String[]> rows = new ArrayList<>();
        try (Workbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            for (int rowIndex = 0; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
                Row row = sheet.getRow(rowIndex);
                if (row == null || row.getLastCellNum() <= 0) {
                    continue;
                }
                String[] values = new String[row.getLastCellNum()];
                for (int c = 0; c < values.length; c++) {
                    values[c] = getCellValueAsString(row.getCell(c));
                }
                rows.add(values);
            }
        } catch (IOException e) {
            throw new DataSourceException("Error reading Excel file: " + e.getMessage(), e);
        }
        return rows;
    }

    private String getCellValueAsString(Cell cell) {
        if (cell == null) return "";

        switch (cell.getCellType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                double numericValue = cell.getNumericCellValue();
                if (numericValue == (long) numericValue) {
                    return String.valueOf((long) numericValue);
                }
                return String.valueOf(numericValue);
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            case FORMULA:
                if (cell.getCachedFormulaResultType() == CellType.NUMERIC) {
                    return String.valueOf(cell.getNumericCellValue());
                }
                return cell.getStringCellValue();
            case BLANK:
            default:
                return "";
        }
    }

    /**
     * Locates the columns from the header row and groups the data rows by product.
     * Repeated (product, date) rows are summed.
     */
    SalesImportResult parseRows(List<String[]> rows) {
        if (rows.isEmpty()) {
            throw new DataSourceException("File has no header row");
        }
        String[] header = rows.get(0);
        int dateCol = findColumn(header, DATE_HEADERS);
        int productIdCol = findColumn(header, PRODUCT_ID_HEADERS);
        int productNameCol = findColumn(header, PRODUCT_NAME_HEADERS);
        int salesCol = findColumn(header, SALES_HEADERS);

        List<String> missing = new ArrayList<>();
        if (dateCol < 0) missing.add("date");
        if (productIdCol < 0) missing.add("product_id");
        if (salesCol < 0) missing.add("sales");
        if (!missing.isEmpty()) {
            throw new DataSourceException("Required columns not found: " + missing + " in header "
                    + Arrays.toString(header));
        }

        SalesImportResult result = new SalesImportResult();
        Map<String, Map<LocalDate, Double>> byProduct = new LinkedHashMap<>();
        int skipped = 0;
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (isBlankRow(row)) {
                continue;
            }
            result.setRowsRead(result.getRowsRead() + 1);

            String productId = cell(row, productIdCol).trim();
            String productName = productNameCol >= 0 ? cell(row, productNameCol).trim() : "";
            String dateText = cell(row, dateCol);
            String salesText = cell(row, salesCol).trim().replace(",", "");

            Optional<LocalDate> date = DateParsers.parse(dateText, DateParsers.SALES_LAYOUTS);
            Double sales = parseSales(salesText);
            if (productId.isEmpty() || date.isEmpty() || sales == null) {
                skipped++;
                if (result.getParseErrors().size() < MAX_REPORTED_ERRORS) {
                    result.getParseErrors().add(describeRowError(i + 1, productId, date.isEmpty(), dateText,
                            sales == null, salesText));
                }
                continue;
            }

            byProduct.computeIfAbsent(productId, k -> new TreeMap<>()).merge(date.get(), sales, Double::sum);
            if (!productName.isEmpty()) {
                result.getProductNames().putIfAbsent(productId, productName);
            }
        }

        byProduct.forEach((productId, values) -> {
            List<Observation> observations = new ArrayList<>(values.size());
            values.forEach((d, v) -> observations.add(new Observation(d, v)));
            result.getSeriesByProduct().put(productId, ObservationSeries.of(observations));
        });
        result.setRowsSkipped(skipped);
        if (skipped > 0) {
            logger.warn("Skipped {} of {} rows that could not be parsed", skipped, result.getRowsRead());
        }
        return result;
    }

    static int findColumn(String[] header, List<String> candidates) {
        for (String candidate : candidates) {
            for (int i = 0; i < header.length; i++) {
                String h = header[i] == null ? "" : header[i].replace("\uFEFF", "").trim();
                if (h.equalsIgnoreCase(candidate)) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String describeRowError(int line, String productId, boolean badDate, String dateText,
                                           boolean badSales, String salesText) {
        StringBuilder sb = new StringBuilder("Row ").append(line).append(':');
        if (productId.isEmpty()) {
            sb.append(" empty product id;");
        }
        if (badDate) {
            sb.append(" unreadable date '").append(dateText).append("';");
        }
        if (badSales) {
            sb.append(" unreadable sales '").append(salesText).append("';");
        }
        return sb.toString();
    }

    private static Double parseSales(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String cell(String[] row, int index) {
        return index >= 0 && index < row.length && row[index] != null ? row[index] : "";
    }

    private static boolean isBlankRow(String[] row) {
        for (String value : row) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
