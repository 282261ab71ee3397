package com.klinevault.fetcher.engine;

import com.klinevault.core.model.PageRequest;
import com.klinevault.core.util.Intervals;

import java.time.Duration;

/**
 * Per-fetch knobs: bar size, page size, per-request timeout, retry budget and pacing.
 */
public record FetchOptions(
    String interval,
    int limit,
    Duration timeout,
    int maxAttempts,
    Duration interPageDelay
) {
    public FetchOptions {
        if (!Intervals.isValid(interval)) {
            throw new IllegalArgumentException("Unknown interval: " + interval);
        }
        PageRequest.validateLimit(limit);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (interPageDelay.isNegative()) {
            throw new IllegalArgumentException("interPageDelay must not be negative");
        }
    }

    public static FetchOptions defaults() {
        return new FetchOptions("30m", PageRequest.MAX_LIMIT, Duration.ofSeconds(15), 8, Duration.ofMillis(200));
    }

    public FetchOptions withLimit(int limit) {
        return new FetchOptions(interval, limit, timeout, maxAttempts, interPageDelay);
    }

    public FetchOptions withMaxAttempts(int maxAttempts) {
        return new FetchOptions(interval, limit, timeout, maxAttempts, interPageDelay);
    }

    public FetchOptions withInterPageDelay(Duration interPageDelay) {
        return new FetchOptions(interval, limit, timeout, maxAttempts, interPageDelay);
    }
}
