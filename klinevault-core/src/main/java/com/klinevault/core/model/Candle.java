package com.klinevault.core.model;

import java.math.BigDecimal;

/**
 * One fixed-interval OHLC kline, keyed by its open time.
 *
 * Prices are kept as the exact decimal strings the upstream sent; they are checked
 * to parse as decimals on construction and never rounded.
 * CSV format: timestamp,open,high,low,close
 */
public record Candle(
    long openTimeMs,
    String open,
    String high,
    String low,
    String close
) {
    public static final String CSV_HEADER = "timestamp,open,high,low,close";

    public Candle {
        open = requireDecimal("open", open);
        high = requireDecimal("high", high);
        low = requireDecimal("low", low);
        close = requireDecimal("close", close);
    }

    private static String requireDecimal(String field, String value) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is missing");
        }
        String trimmed = value.trim();
        try {
            new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " is not a decimal: '" + value + "'");
        }
        return trimmed;
    }

    public BigDecimal openValue() {
        return new BigDecimal(open);
    }

    public BigDecimal highValue() {
        return new BigDecimal(high);
    }

    public BigDecimal lowValue() {
        return new BigDecimal(low);
    }

    public BigDecimal closeValue() {
        return new BigDecimal(close);
    }

    /**
     * Parse a CSV line written by {@link #toCsv()}.
     */
    public static Candle fromCsv(String line) {
        String[] parts = line.split(",");
        if (parts.length < 5) {
            throw new IllegalArgumentException("Invalid CSV line: " + line);
        }
        return new Candle(Long.parseLong(parts[0].trim()), parts[1], parts[2], parts[3], parts[4]);
    }

    public String toCsv() {
        return openTimeMs + "," + open + "," + high + "," + low + "," + close;
    }
}
