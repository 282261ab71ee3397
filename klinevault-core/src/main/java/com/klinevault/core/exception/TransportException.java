package com.klinevault.core.exception;

/**
 * Network-level failure of a single request attempt (connection refused, timeout, DNS).
 */
public class TransportException extends FetchException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
