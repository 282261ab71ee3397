package com.klinevault.core.exception;

/**
 * A 200 response whose body is not a valid kline page.
 */
public class MalformedResponseException extends FetchException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
