package com.klinevault.core.exception;

/**
 * Page size outside what the upstream accepts. A configuration error, raised before any request.
 */
public class InvalidLimitException extends IllegalArgumentException {

    private final int limit;

    public InvalidLimitException(int limit, int maxLimit) {
        super("limit must be between 1 and " + maxLimit + ", was " + limit);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
