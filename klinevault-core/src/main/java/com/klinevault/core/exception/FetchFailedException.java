package com.klinevault.core.exception;

/**
 * Retry budget for one page ran out. Terminal for the whole multi-page fetch;
 * {@link #getCause()} is the failure seen on the last attempt.
 */
public class FetchFailedException extends FetchException {

    private final int attempts;

    public FetchFailedException(int attempts, FetchException lastCause) {
        super("Request failed after " + attempts + " attempt(s): " + lastCause.getMessage(), lastCause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public synchronized FetchException getCause() {
        return (FetchException) super.getCause();
    }
}
