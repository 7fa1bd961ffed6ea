package com.example.pageturner.http;

import com.example.pageturner.RequestAhead;

/**
 * Offset-based page request: the page starting at {@code offset} with at most
 * {@code limit} items.
 *
 * <p>The following request is computed locally, which makes offset pagination
 * usable with look-ahead streams.
 *
 * @param offset index of the first item of the page
 * @param limit page size
 */
public record OffsetPageRequest(long offset, int limit) implements RequestAhead<OffsetPageRequest> {

    public OffsetPageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got " + limit);
        }
    }

    /**
     * Creates the request for the first page.
     */
    public static OffsetPageRequest first(int limit) {
        return new OffsetPageRequest(0, limit);
    }

    @Override
    public OffsetPageRequest nextRequest() {
        return new OffsetPageRequest(offset + limit, limit);
    }
}
