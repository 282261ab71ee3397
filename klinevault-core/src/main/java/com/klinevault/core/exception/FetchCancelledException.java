package com.klinevault.core.exception;

public class FetchCancelledException extends FetchException {

    public FetchCancelledException(String message) {
        super(message);
    }
}
