package com.klinevault.fetcher.engine;

import java.time.Duration;

/**
 * Attempt-indexed exponential backoff: {@code min(base^attempt, cap)} seconds.
 */
public record BackoffPolicy(int base, Duration cap) {

    public static final BackoffPolicy DEFAULT = new BackoffPolicy(2, Duration.ofSeconds(30));

    public BackoffPolicy {
        if (base < 1) {
            throw new IllegalArgumentException("base must be >= 1");
        }
        if (cap.isNegative()) {
            throw new IllegalArgumentException("cap must not be negative");
        }
    }

    /**
     * Delay after failed attempt number {@code attempt} (1-based).
     */
    public Duration delayAfter(int attempt) {
        long capSeconds = cap.toSeconds();
        long seconds = 1;
        for (int i = 0; i < attempt && seconds < capSeconds; i++) {
            seconds *= base;
        }
        return Duration.ofSeconds(Math.min(seconds, capSeconds));
    }
}
