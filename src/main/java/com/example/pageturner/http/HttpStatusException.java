package com.example.pageturner.http;

/**
 * Exception thrown when the server answers a page request with an error status.
 */
public class HttpStatusException extends RuntimeException {

    private final int statusCode;

    public HttpStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns true for 404, the status servers typically answer for pages past the end.
     */
    public boolean isNotFound() {
        return statusCode == 404;
    }
}
