package com.example.pageturner.config;

import com.example.pageturner.Limit;
import com.example.pageturner.async.listener.PagesAheadListener;

import java.util.Objects;

/**
 * Configuration of a look-ahead page stream.
 *
 * @param requestsAheadCount window size: the maximum number of concurrently in-flight
 *                           requests, 0 yields an empty stream
 * @param limit cap on the total number of requests issued
 * @param listener observer of scheduling events
 */
public record PagesAheadConfig(
        int requestsAheadCount,
        Limit limit,
        PagesAheadListener listener
) {
    public PagesAheadConfig {
        if (requestsAheadCount < 0) {
            throw new IllegalArgumentException(
                    "requestsAheadCount must be >= 0, got " + requestsAheadCount);
        }
        Objects.requireNonNull(limit, "limit");
        listener = listener != null ? listener : PagesAheadListener.noop();
    }

    /**
     * Creates a configuration without a listener.
     */
    public static PagesAheadConfig of(int requestsAheadCount, Limit limit) {
        return new PagesAheadConfig(requestsAheadCount, limit, PagesAheadListener.noop());
    }

    /**
     * Creates an unlimited configuration without a listener.
     */
    public static PagesAheadConfig of(int requestsAheadCount) {
        return of(requestsAheadCount, Limit.none());
    }

    public PagesAheadConfig withLimit(Limit newLimit) {
        return new PagesAheadConfig(requestsAheadCount, newLimit, listener);
    }

    public PagesAheadConfig withListener(PagesAheadListener newListener) {
        return new PagesAheadConfig(requestsAheadCount, limit, newListener);
    }
}
