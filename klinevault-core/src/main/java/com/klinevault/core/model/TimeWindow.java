package com.klinevault.core.model;

import com.klinevault.core.exception.InvalidRangeException;

/**
 * Half-open window [startMs, endMs) in Unix milliseconds, UTC.
 */
public record TimeWindow(long startMs, long endMs) {

    public TimeWindow {
        if (startMs >= endMs) {
            throw new InvalidRangeException(startMs, endMs);
        }
    }

    public boolean contains(long timestampMs) {
        return timestampMs >= startMs && timestampMs < endMs;
    }

    public long durationMs() {
        return endMs - startMs;
    }
}
