package com.klinevault.core.exception;

/**
 * A time window whose start is not before its end, where forward progress is required.
 */
public class InvalidRangeException extends IllegalArgumentException {

    public InvalidRangeException(long startMs, long endMs) {
        super("start (" + startMs + ") must be before end (" + endMs + ")");
    }
}
