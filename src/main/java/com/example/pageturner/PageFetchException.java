package com.example.pageturner;

import java.util.OptionalLong;

/**
 * Terminal error of a page stream: wraps the failure of the page turner for
 * one request.
 *
 * <p>The cause is the original failure reported by the page turner. Look-ahead
 * schedulers also record the position of the failed request in the request
 * chain.
 */
public class PageFetchException extends RuntimeException {

    private final transient Object request;
    private final long requestIndex;

    public PageFetchException(Object request, Throwable cause) {
        this(request, -1, cause);
    }

    public PageFetchException(Object request, long requestIndex, Throwable cause) {
        super(buildMessage(request, requestIndex, cause), cause);
        this.request = request;
        this.requestIndex = requestIndex;
    }

    private static String buildMessage(Object request, long requestIndex, Throwable cause) {
        StringBuilder message = new StringBuilder("Failed to fetch page");
        if (requestIndex >= 0) {
            message.append(" #").append(requestIndex);
        }
        message.append(" with request: ").append(request);
        if (cause != null && cause.getMessage() != null) {
            message.append(": ").append(cause.getMessage());
        }
        return message.toString();
    }

    /**
     * Returns the request that failed.
     */
    public Object getRequest() {
        return request;
    }

    /**
     * Returns the 0-based position of the failed request in the request chain,
     * if the stream that failed tracks it.
     */
    public OptionalLong getRequestIndex() {
        return requestIndex >= 0 ? OptionalLong.of(requestIndex) : OptionalLong.empty();
    }
}
