package com.motaz.uptake.batch.service;

import com.motaz.uptake.batch.model.PrescriptionRow;
import com.motaz.uptake.core.events.TemporalEventGrouper;
import com.motaz.uptake.core.exception.DataQualityException;
import com.motaz.uptake.core.exception.SchemaValidationException;
import com.motaz.uptake.core.exception.UptakeException;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads and validates a prescriptions CSV. Any violation aborts the whole
 * load, so callers never see a partially valid batch.
 */
@Slf4j
@Component
public class PrescriptionCsvLoader {

    public static final List<String> REQUIRED_COLUMNS =
            List.of("date", "product", "region", "units", "price_per_unit", "revenue", "event_type");

    private static final Comparator<PrescriptionRow> COHORT_ORDER = Comparator
            .comparing(PrescriptionRow::getProduct)
            .thenComparing(PrescriptionRow::getRegion)
            .thenComparing(PrescriptionRow::getDate);

    public List<PrescriptionRow> load(Path csvPath) {
        if (!Files.isRegularFile(csvPath)) {
            throw new DataQualityException("CSV file not found: " + csvPath);
        }
        log.info("Loading prescriptions from {}", csvPath);

        List<PrescriptionRow> rows = new ArrayList<>();
        try (CSVReader reader = new CSVReader(Files.newBufferedReader(csvPath, StandardCharsets.UTF_8))) {
            Map<String, Integer> columns = columnIndex(reader.readNext());
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (line.length == 1 && line[0].isBlank()) {
                    continue;
                }
                rows.add(parse(line, columns, reader.getLinesRead()));
            }
        } catch (IOException | CsvValidationException e) {
            log.error("Failed to read CSV file: {}", csvPath, e);
            throw new UptakeException("Failed to read CSV file: " + csvPath, e);
        }

        rows.sort(COHORT_ORDER);
        log.info("Data validated: {} rows", rows.size());
        return rows;
    }

    private static Map<String, Integer> columnIndex(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        if (header != null) {
            for (int i = 0; i < header.length; i++) {
                // Excel likes to prepend a BOM
                columns.put(header[i].replace("\uFEFF", "").trim(), i);
            }
        }
        Set<String> missing = new TreeSet<>(REQUIRED_COLUMNS);
        missing.removeAll(columns.keySet());
        if (!missing.isEmpty()) {
            throw new SchemaValidationException("Missing required columns: " + missing);
        }
        return columns;
    }

    private static PrescriptionRow parse(String[] line, Map<String, Integer> columns, long lineNumber) {
        LocalDate date = parseDate(cell(line, columns, "date"));
        if (date == null) {
            throw new DataQualityException("Invalid or null date on line " + lineNumber);
        }
        Double units = parseNumber(cell(line, columns, "units"));
        if (units == null || units < 0) {
            throw new DataQualityException("Negative or missing units on line " + lineNumber);
        }
        if (units != Math.rint(units)) {
            throw new DataQualityException("Units must be a whole number on line " + lineNumber + ": " + units);
        }
        Double price = parseNumber(cell(line, columns, "price_per_unit"));
        if (price == null || price <= 0) {
            throw new DataQualityException("Invalid price_per_unit on line " + lineNumber);
        }
        Double revenue = parseNumber(cell(line, columns, "revenue"));
        if (revenue == null || revenue < 0) {
            throw new DataQualityException("Negative or missing revenue on line " + lineNumber);
        }
        String eventType = cell(line, columns, "event_type");
        return PrescriptionRow.builder()
                .date(date)
                .product(cell(line, columns, "product"))
                .region(cell(line, columns, "region"))
                .units(units.longValue())
                .pricePerUnit(price)
                .revenue(revenue)
                .eventType(eventType.isEmpty() ? TemporalEventGrouper.INACTIVE : eventType)
                .build();
    }

    private static String cell(String[] line, Map<String, Integer> columns, String name) {
        int index = columns.get(name);
        return index < line.length ? line[index].trim() : "";
    }

    /** Accepts a plain ISO date or an ISO timestamp, keeping the date part. */
    static LocalDate parseDate(String value) {
        if (value.isEmpty()) {
            return null;
        }
        String datePart = value.length() > 10 ? value.substring(0, 10) : value;
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Double parseNumber(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
