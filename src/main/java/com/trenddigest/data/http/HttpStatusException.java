package com.trenddigest.data.http;

/**
 * Non-2xx HTTP reply. Carries the status so callers can classify without parsing messages.
 */
public class HttpStatusException extends RuntimeException {
    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
