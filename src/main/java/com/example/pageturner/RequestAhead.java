package com.example.pageturner;

/**
 * A request that can produce the request for the following page without
 * performing any I/O.
 *
 * <p>Implementing this interface enables the look-ahead schedulers, which
 * precompute a chain of requests and query several pages concurrently.
 *
 * <p><b>Caveats:</b>
 * <ul>
 *   <li>{@link #nextRequest()} must produce the same request the page turner
 *       itself would return as {@link TurnedPage#nextRequest()}, otherwise
 *       look-ahead streams and {@link PageTurner#pages} yield different results.
 *       The schedulers cannot detect the mismatch.</li>
 *   <li>The page turner must eventually return {@link TurnedPage#last}, or the
 *       stream must be capped with {@link Limit#pages(int)}, otherwise look-ahead
 *       streams end with the error of the first request past the end.</li>
 * </ul>
 *
 * @param <R> the request type itself
 */
@FunctionalInterface
public interface RequestAhead<R extends RequestAhead<R>> {

    /**
     * Returns the request for the page after the one this request queries.
     * Must be pure and deterministic.
     */
    R nextRequest();
}
