package com.example.pageturner;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of fetching one page: the items of that page and an optional
 * request for the page after it.
 *
 * <p>An empty {@code nextRequest} marks the last page. Pagination stops there.
 *
 * @param <R> the request type
 * @param <T> the type of items in the page
 */
public record TurnedPage<R, T>(
        List<T> items,
        Optional<R> nextRequest
) {
    public TurnedPage {
        items = items != null ? List.copyOf(items) : List.of();
        nextRequest = nextRequest != null ? nextRequest : Optional.empty();
    }

    /**
     * Creates a page followed by another page queried with {@code nextRequest}.
     */
    public static <R, T> TurnedPage<R, T> next(List<T> items, R nextRequest) {
        return new TurnedPage<>(items, Optional.of(nextRequest));
    }

    /**
     * Creates the last page (no more pages after this).
     */
    public static <R, T> TurnedPage<R, T> last(List<T> items) {
        return new TurnedPage<>(items, Optional.empty());
    }

    /**
     * Creates a page whose successor is {@code nextRequest}, or the last page if it is null.
     */
    public static <R, T> TurnedPage<R, T> of(List<T> items, R nextRequest) {
        return new TurnedPage<>(items, Optional.ofNullable(nextRequest));
    }

    /**
     * Checks if this is the last page.
     */
    public boolean isLast() {
        return nextRequest.isEmpty();
    }

    /**
     * Returns the number of items in this page.
     */
    public int size() {
        return items.size();
    }
}
