package org.nowstart.crossover.backtest.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.crossover.backtest.model.PricePoint;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class PriceSeriesCsvLoader {

    private static final List<String> TIMESTAMP_COLUMNS = List.of("timestamp", "date");
    private static final List<String> PRICE_COLUMNS = List.of("price", "adj close", "close");
    // yfinance exports: "Price,Adj Close,..." then "Ticker,..." and "Date,..." label rows.
    private static final List<String> MULTI_LEVEL_PRICE_COLUMNS = List.of("adj close", "close");
    private static final List<String> LABEL_ROWS = List.of("ticker", "date");

    public PriceSeries load(Path path) {
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            PriceSeries series = parse(lines, path.toString());
            log.info("[Backtest][DATA] loaded path={} rows={}", path.toAbsolutePath(), series.size());
            return series;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load CSV: " + path, e);
        }
    }

    PriceSeries parse(List<String> lines, String source) {
        if (lines.size() < 2) {
            throw new IllegalArgumentException("CSV has no rows: " + source);
        }

        String[] header = splitCsvLine(stripBom(lines.get(0)));
        boolean multiLevel = isMultiLevelHeader(header);
        int timestampColumn = multiLevel ? 0 : findColumn(header, TIMESTAMP_COLUMNS, source);
        int priceColumn = findColumn(header, multiLevel ? MULTI_LEVEL_PRICE_COLUMNS : PRICE_COLUMNS, source);
        int firstDataLine = multiLevel ? skipLabelRows(lines) : 1;

        Map<Instant, PricePoint> dedup = new LinkedHashMap<>();
        int skipped = 0;
        for (int i = firstDataLine; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = splitCsvLine(line);
            if (parts.length <= Math.max(timestampColumn, priceColumn)) {
                throw new IllegalArgumentException("CSV line " + (i + 1) + " has too few columns: " + source);
            }
            String rawPrice = parts[priceColumn].trim();
            if (rawPrice.isEmpty() || rawPrice.equalsIgnoreCase("null")) {
                skipped++;
                continue;
            }
            Instant ts = parseTs(parts[timestampColumn]);
            dedup.put(ts, new PricePoint(ts, parseDouble(rawPrice, i + 1)));
        }
        if (skipped > 0) {
            log.warn("[Backtest][DATA] skipped rows without price source={} skipped={}", source, skipped);
        }
        if (dedup.isEmpty()) {
            throw new IllegalArgumentException("CSV has no price rows: " + source);
        }

        List<PricePoint> out = new ArrayList<>(dedup.values());
        out.sort(Comparator.comparing(PricePoint::timestamp));
        return PriceSeries.of(out);
    }

    private boolean isMultiLevelHeader(String[] header) {
        if (!normalize(header[0]).equals("price")) {
            return false;
        }
        for (String column : header) {
            if (TIMESTAMP_COLUMNS.contains(normalize(column))) {
                return false;
            }
        }
        return true;
    }

    private int skipLabelRows(List<String> lines) {
        int line = 1;
        while (line < lines.size() && LABEL_ROWS.contains(normalize(splitCsvLine(lines.get(line))[0]))) {
            line++;
        }
        return line;
    }

    private String normalize(String cell) {
        return cell.trim().toLowerCase(Locale.ROOT);
    }

    private int findColumn(String[] header, List<String> candidates, String source) {
        for (String candidate : candidates) {
            for (int i = 0; i < header.length; i++) {
                if (normalize(header[i]).equals(candidate)) {
                    return i;
                }
            }
        }
        throw new IllegalArgumentException("CSV header must contain one of " + candidates + ": " + source);
    }

    Instant parseTs(String raw) {
        String ts = raw.trim();
        try {
            if (ts.length() == 10) {
                return LocalDate.parse(ts).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (ts.length() > 10 && ts.charAt(10) == ' ') {
                ts = ts.substring(0, 10) + 'T' + ts.substring(11);
            }
            if (ts.endsWith("Z") || ts.endsWith("z")) {
                return Instant.parse(ts.toUpperCase(Locale.ROOT));
            }
            if (hasOffset(ts)) {
                return OffsetDateTime.parse(ts).toInstant();
            }
            return LocalDateTime.parse(ts).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unsupported timestamp: " + raw, e);
        }
    }

    private boolean hasOffset(String ts) {
        int timeStart = ts.indexOf('T');
        return timeStart > 0 && (ts.indexOf('+', timeStart) > 0 || ts.indexOf('-', timeStart) > 0);
    }

    private double parseDouble(String raw, int lineNumber) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("CSV line " + lineNumber + " has invalid price: " + raw, e);
        }
    }

    private String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }

    private String[] splitCsvLine(String line) {
        return line.split(",", -1);
    }
}
