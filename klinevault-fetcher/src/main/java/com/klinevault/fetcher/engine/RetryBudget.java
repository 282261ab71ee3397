package com.klinevault.fetcher.engine;

/**
 * Attempt counter for one page request. A new budget is made for every page.
 */
final class RetryBudget {

    private final int maxAttempts;
    private int attempt = 1;

    RetryBudget(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    int attempt() {
        return attempt;
    }

    int maxAttempts() {
        return maxAttempts;
    }

    boolean hasRemaining() {
        return attempt < maxAttempts;
    }

    void next() {
        if (!hasRemaining()) {
            throw new IllegalStateException("Retry budget exhausted after " + maxAttempts + " attempts");
        }
        attempt++;
    }
}
