package com.klinevault.core.exception;

/**
 * A fetch completed but the upstream had no klines for the requested range.
 */
public class NoDataException extends FetchException {

    public NoDataException(String message) {
        super(message);
    }
}
