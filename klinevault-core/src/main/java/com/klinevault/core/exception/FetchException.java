package com.klinevault.core.exception;

/**
 * Base type for failures while pulling klines from an upstream API.
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
