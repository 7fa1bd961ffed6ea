package com.example.pageturner.request;

import com.example.pageturner.Limit;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A lazy, capped sequence of requests derived from a starting request.
 *
 * <p>Each call to {@link #next()} returns the current request and replaces it
 * with {@code nextRequest.apply(current)}. No I/O is performed: the sequence is
 * computed purely from the request chain function, never from responses.
 *
 * <p>Example usage:
 * <pre>{@code
 * RequestIter<Integer> pages = new RequestIter<>(1, page -> page + 1, Limit.pages(3));
 * // yields 1, 2, 3
 * }</pre>
 *
 * <p>The sequence is single-pass. Create a new instance for every stream.
 *
 * @param <R> the request type
 */
public class RequestIter<R> implements Iterator<R> {

    private final UnaryOperator<R> nextRequest;
    private final Limit limit;

    private R currentRequest;
    private long counter = 0;

    /**
     * Creates a new RequestIter.
     *
     * @param request the first request of the sequence
     * @param nextRequest pure function deriving the following request
     * @param limit cap on the number of requests produced
     */
    public RequestIter(R request, UnaryOperator<R> nextRequest, Limit limit) {
        this.currentRequest = Objects.requireNonNull(request, "request");
        this.nextRequest = Objects.requireNonNull(nextRequest, "nextRequest");
        this.limit = Objects.requireNonNull(limit, "limit");
    }

    @Override
    public boolean hasNext() {
        return currentRequest != null && !limit.isReachedBy(counter);
    }

    @Override
    public R next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Request sequence is exhausted");
        }

        R requestToReturn = currentRequest;
        currentRequest = nextRequest.apply(requestToReturn);
        counter++;
        return requestToReturn;
    }

    /**
     * Returns the number of requests produced so far.
     */
    public long produced() {
        return counter;
    }

    /**
     * Wraps this sequence so that every request carries its 0-based position.
     */
    public Iterator<NumberedRequest<R>> numbered() {
        return new Iterator<>() {
            private long index = 0;

            @Override
            public boolean hasNext() {
                return RequestIter.this.hasNext();
            }

            @Override
            public NumberedRequest<R> next() {
                return new NumberedRequest<>(index++, RequestIter.this.next());
            }
        };
    }
}
