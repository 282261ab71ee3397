package com.klinevault.fetcher.store;

import com.klinevault.core.model.Candle;
import com.klinevault.core.util.UtcTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads OHLC CSV files from other tools into candles.
 *
 * Header names are normalized (time/datetime/date -> timestamp, open_ -> open, ...).
 * Numeric timestamps are read as milliseconds when their median exceeds 1e12, as seconds
 * otherwise; text timestamps must be ISO-8601. Rows with an unreadable timestamp or price
 * are dropped, and the result is sorted by open time.
 */
public class CsvCandleImporter {

    private static final Logger log = LoggerFactory.getLogger(CsvCandleImporter.class);
    private static final List<String> REQUIRED = List.of("timestamp", "open", "high", "low", "close");
    private static final double MILLIS_THRESHOLD = 1e12;

    public List<Candle> load(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            throw new IOException("Empty CSV file: " + file);
        }

        Map<String, Integer> columns = mapColumns(CsvUtils.splitLine(CsvUtils.stripBom(lines.get(0))));
        List<String> missing = REQUIRED.stream().filter(c -> !columns.containsKey(c)).toList();
        if (!missing.isEmpty()) {
            throw new IOException("Missing required columns " + missing + " in " + file.getFileName());
        }

        List<List<String>> rows = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            if (!line.isBlank()) {
                rows.add(CsvUtils.splitLine(line));
            }
        }

        int tsColumn = columns.get("timestamp");
        TimestampReader timestamps = detectTimestampFormat(rows, tsColumn);

        List<Candle> candles = new ArrayList<>();
        int dropped = 0;
        for (List<String> row : rows) {
            Candle candle = toCandle(row, columns, timestamps);
            if (candle == null) {
                dropped++;
            } else {
                candles.add(candle);
            }
        }
        candles.sort(Comparator.comparingLong(Candle::openTimeMs));

        if (dropped > 0) {
            log.warn("Dropped {} unreadable rows from {}", dropped, file.getFileName());
        }
        log.info("Imported {} candles from {}", candles.size(), file.getFileName());
        return candles;
    }

    static Map<String, Integer> mapColumns(List<String> header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String canonical = canonicalName(header.get(i));
            if (canonical != null) {
                columns.putIfAbsent(canonical, i);
            }
        }
        return columns;
    }

    static String canonicalName(String column) {
        String name = column.trim().toLowerCase(Locale.ROOT);
        return switch (name) {
            case "timestamp", "time", "datetime", "date" -> "timestamp";
            case "open", "open_" -> "open";
            case "high", "high_" -> "high";
            case "low", "low_" -> "low";
            case "close", "close_" -> "close";
            case "volume", "vol" -> "volume";
            default -> null;
        };
    }

    private static TimestampReader detectTimestampFormat(List<List<String>> rows, int tsColumn) {
        List<Double> numeric = new ArrayList<>();
        for (List<String> row : rows) {
            String value = field(row, tsColumn);
            if (value.isEmpty()) continue;
            Double parsed = parseDouble(value);
            if (parsed == null) {
                return TimestampReader.ISO_TEXT;
            }
            numeric.add(parsed);
        }
        if (numeric.isEmpty()) {
            return TimestampReader.ISO_TEXT;
        }
        return median(numeric) > MILLIS_THRESHOLD ? TimestampReader.EPOCH_MILLIS : TimestampReader.EPOCH_SECONDS;
    }

    private static Candle toCandle(List<String> row, Map<String, Integer> columns, TimestampReader timestamps) {
        Long openTime = timestamps.read(field(row, columns.get("timestamp")));
        if (openTime == null) {
            return null;
        }
        try {
            return new Candle(openTime,
                field(row, columns.get("open")), field(row, columns.get("high")),
                field(row, columns.get("low")), field(row, columns.get("close")));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String field(List<String> row, int index) {
        return index < row.size() ? row.get(index).trim() : "";
    }

    private static Double parseDouble(String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double median(List<Double> values) {
        double[] sorted = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private enum TimestampReader {
        EPOCH_MILLIS {
            @Override
            Long read(String value) {
                return epoch(value, 1);
            }
        },
        EPOCH_SECONDS {
            @Override
            Long read(String value) {
                return epoch(value, 1000);
            }
        },
        ISO_TEXT {
            @Override
            Long read(String value) {
                if (value.isEmpty()) return null;
                try {
                    return UtcTimes.parseToEpochMillis(value.replace(' ', 'T'));
                } catch (DateTimeException e) {
                    return null;
                }
            }
        };

        abstract Long read(String value);

        private static Long epoch(String value, long factor) {
            if (value.isEmpty()) return null;
            try {
                return new BigDecimal(value).multiply(BigDecimal.valueOf(factor)).longValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
