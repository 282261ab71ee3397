package com.klinevault.core.model;

import com.klinevault.core.exception.InvalidLimitException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One bounded request for klines in [startMs, endMs).
 */
public record PageRequest(
    String symbol,
    String interval,
    long startMs,
    long endMs,
    int limit
) {
    /** Hard cap on rows per page enforced by the upstream. */
    public static final int MAX_LIMIT = 1000;

    public PageRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        if (interval == null || interval.isBlank()) {
            throw new IllegalArgumentException("interval is required");
        }
        validateLimit(limit);
        // Reuses the window invariant: a page must cover at least one millisecond
        new TimeWindow(startMs, endMs);
    }

    public static void validateLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidLimitException(limit, MAX_LIMIT);
        }
    }

    public TimeWindow window() {
        return new TimeWindow(startMs, endMs);
    }

    /**
     * Query parameters in wire order. The upstream treats endTime as inclusive,
     * so the exclusive end is sent as endMs - 1.
     */
    public Map<String, String> toQueryParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("interval", interval);
        params.put("startTime", String.valueOf(startMs));
        params.put("endTime", String.valueOf(endMs - 1));
        params.put("limit", String.valueOf(limit));
        return params;
    }
}
