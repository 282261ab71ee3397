package com.klinevault.core.model;

/**
 * Progress information for a multi-page kline fetch.
 */
public record FetchProgress(
    int fetchedCandles,     // Number of candles fetched so far
    int estimatedTotal,     // Estimated total candles in the range
    String message          // Human-readable status message
) {
    /**
     * Calculate the percentage complete.
     */
    public int percentComplete() {
        if (estimatedTotal == 0) return 0;
        return (int) Math.min(100, (fetchedCandles * 100L) / estimatedTotal);
    }

    public static FetchProgress starting(String symbol, String interval) {
        return new FetchProgress(0, 0, "Starting fetch for " + symbol + " " + interval + "...");
    }

    public static FetchProgress complete(int totalFetched) {
        return new FetchProgress(totalFetched, totalFetched, "Complete");
    }

    public static FetchProgress cancelled(int fetchedSoFar) {
        return new FetchProgress(fetchedSoFar, fetchedSoFar, "Cancelled");
    }
}
