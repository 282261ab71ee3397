package com.klinevault.core.util;

import java.time.Duration;

/**
 * Kline interval codes as used by Binance ("1m", "30m", "4h", "1d", ...).
 */
public final class Intervals {

    private Intervals() {
    }

    /**
     * Get interval length in milliseconds.
     *
     * @throws IllegalArgumentException for an unknown code
     */
    public static long toMillis(String interval) {
        return switch (interval) {
            case "1m" -> Duration.ofMinutes(1).toMillis();
            case "3m" -> Duration.ofMinutes(3).toMillis();
            case "5m" -> Duration.ofMinutes(5).toMillis();
            case "15m" -> Duration.ofMinutes(15).toMillis();
            case "30m" -> Duration.ofMinutes(30).toMillis();
            case "1h" -> Duration.ofHours(1).toMillis();
            case "2h" -> Duration.ofHours(2).toMillis();
            case "4h" -> Duration.ofHours(4).toMillis();
            case "6h" -> Duration.ofHours(6).toMillis();
            case "8h" -> Duration.ofHours(8).toMillis();
            case "12h" -> Duration.ofHours(12).toMillis();
            case "1d" -> Duration.ofDays(1).toMillis();
            case "3d" -> Duration.ofDays(3).toMillis();
            case "1w" -> Duration.ofDays(7).toMillis();
            case "1M" -> Duration.ofDays(30).toMillis();
            default -> throw new IllegalArgumentException("Unknown interval: " + interval);
        };
    }

    public static boolean isValid(String interval) {
        try {
            toMillis(interval);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Rough number of klines in [startMs, endMs), at least 1. Used for progress only.
     */
    public static int estimateCount(long startMs, long endMs, String interval) {
        long count = (endMs - startMs) / toMillis(interval);
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, count));
    }
}
