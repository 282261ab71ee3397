package com.klinevault.core.exception;

/**
 * The upstream answered a single attempt with a status other than 200.
 * Rate-limit statuses (429, 418) are not singled out.
 */
public class UpstreamException extends FetchException {

    private final int statusCode;

    public UpstreamException(int statusCode, String bodySnippet) {
        super("HTTP " + statusCode + (bodySnippet == null || bodySnippet.isEmpty() ? "" : ": " + bodySnippet));
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
