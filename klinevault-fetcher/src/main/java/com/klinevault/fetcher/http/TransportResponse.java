package com.klinevault.fetcher.http;

import java.nio.charset.StandardCharsets;

/**
 * Raw outcome of one HTTP exchange: status code and body bytes.
 */
public record TransportResponse(int statusCode, byte[] body) {

    public TransportResponse {
        body = body == null ? new byte[0] : body;
    }

    public static TransportResponse ok(String json) {
        return new TransportResponse(200, json.getBytes(StandardCharsets.UTF_8));
    }

    public static TransportResponse status(int statusCode, String text) {
        return new TransportResponse(statusCode, text.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isOk() {
        return statusCode == 200;
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * First {@code max} characters of the body, for error messages.
     */
    public String bodySnippet(int max) {
        String text = bodyText();
        return text.length() <= max ? text : text.substring(0, max);
    }
}
