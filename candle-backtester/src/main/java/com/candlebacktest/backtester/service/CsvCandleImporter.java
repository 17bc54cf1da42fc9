package com.candlebacktest.backtester.service;

import com.candlebacktest.backtester.domain.Candle;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Reads OHLCV candles from CSV.
 * Expected format: timestamp,open,high,low,close,volume with an optional header row.
 *
 * <p>Timestamps may be epoch milliseconds, epoch seconds, ISO-8601 instants or date-times,
 * or plain dates (all UTC). Malformed rows are skipped and reported in the result.
 */
@Service
@Slf4j
public class CsvCandleImporter {

    private static final double EPOCH_SECONDS_LIMIT = 1e11;

    private static final DateTimeFormatter[] DATE_FORMATTERS = {
            DateTimeFormatter.ofPattern("yyyy-MM-dd"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yyyy")
    };

    @Value
    public static class RowError {
        int row;
        String line;
        String error;
    }

    @Value
    public static class ImportResult {
        List<Candle> candles;
        List<RowError> errors;
        int totalRows;

        public int getValidRows() {
            return candles.size();
        }
    }

    public ImportResult importFile(Path path) throws IOException {
        log.info("Importing candles from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importCsv(reader);
        }
    }

    public ImportResult importString(String csvContent) {
        try {
            return importCsv(new StringReader(csvContent));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read CSV content", e);
        }
    }

    public ImportResult importCsv(Reader source) throws IOException {
        List<Candle> candles = new ArrayList<>();
        List<RowError> errors = new ArrayList<>();
        int totalRows = 0;

        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            int rowNumber = 0;
            boolean isFirstLine = true;

            while ((line = reader.readLine()) != null) {
                rowNumber++;
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }

                // Skip header row
                if (isFirstLine) {
                    isFirstLine = false;
                    if (isHeader(line)) {
                        continue;
                    }
                }

                totalRows++;
                try {
                    candles.add(parseLine(line));
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    log.warn("Failed to parse CSV line {}: {} - Error: {}", rowNumber, line, e.getMessage());
                    errors.add(new RowError(rowNumber, line, e.getMessage()));
                }
            }
        }

        candles.sort(Comparator.comparingLong(Candle::getTimestamp));
        log.info("CSV import completed: {} candles, {} rejected rows", candles.size(), errors.size());
        return new ImportResult(Collections.unmodifiableList(candles), Collections.unmodifiableList(errors), totalRows);
    }

    private static boolean isHeader(String line) {
        String lower = line.toLowerCase();
        return lower.contains("time") || lower.contains("date") || lower.contains("open");
    }

    Candle parseLine(String line) {
        List<String> parts = split(line);
        if (parts.size() < 6) {
            throw new IllegalArgumentException("Expected 6 columns but found " + parts.size());
        }

        return Candle.builder()
                .timestamp(parseTimestamp(parts.get(0)))
                .open(parseNumber("open", parts.get(1)))
                .high(parseNumber("high", parts.get(2)))
                .low(parseNumber("low", parts.get(3)))
                .close(parseNumber("close", parts.get(4)))
                .volume(parseNumber("volume", parts.get(5)))
                .build();
    }

    private static List<String> split(String line) {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (c == ',' && !inQuotes) {
                values.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        values.add(current.toString().trim());
        return values;
    }

    // "NaN" parses to NaN and is kept, the engine rejects it when the candle is reached
    private static double parseNumber(String field, String value) {
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Missing value for field '" + field + "'");
        }
        try {
            return Double.parseDouble(value.replace(",", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + field + " value: " + value, e);
        }
    }

    /**
     * Parse a timestamp cell into epoch milliseconds.
     */
    static long parseTimestamp(String value) {
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Missing value for field 'timestamp'");
        }
        if (value.matches("-?\\d+(\\.\\d+)?")) {
            double numeric = Double.parseDouble(value);
            return numeric < EPOCH_SECONDS_LIMIT ? (long) (numeric * 1000) : (long) numeric;
        }
        if (value.endsWith("Z") || value.matches(".*[+-]\\d{2}:\\d{2}$")) {
            return OffsetDateTime.parse(value).toInstant().toEpochMilli();
        }
        if (value.contains("T")) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        return parseDate(value).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    /**
     * Parse date with multiple format support.
     */
    static LocalDate parseDate(String value) {
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            try {
                return LocalDate.parse(value, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Date {} does not match {}", value, formatter);
            }
        }
        throw new IllegalArgumentException("Unable to parse date: " + value);
    }
}
