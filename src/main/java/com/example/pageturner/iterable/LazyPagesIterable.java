package com.example.pageturner.iterable;

import com.example.pageturner.iterable.iterator.BlockingIterator;
import com.example.pageturner.async.iterator.AsyncIterator;

import java.util.Iterator;
import java.util.function.Supplier;

/**
 * A lazy Iterable that starts a fresh page stream on demand.
 *
 * <p>Every call to {@link #iterator()} asks the supplier for a new stream, so this
 * Iterable can be iterated multiple times. Request sequences are single-pass and can't
 * be shared between iterations.
 *
 * <p><b>Side effects:</b> Be aware that iterating multiple times queries the underlying
 * API again.
 *
 * <p>Example usage:
 * <pre>{@code
 * LazyPagesIterable<BlogRecord> records = new LazyPagesIterable<>(
 *     () -> PageTurners.pagesAhead(blog, 4, Limit.none(), new GetContentRequest(0)).items()
 * );
 *
 * for (BlogRecord record : records) {
 *     process(record);
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> creating iterators is thread-safe if the supplier is. Individual
 * iterators are NOT thread-safe.
 *
 * @param <T> the type of elements
 */
public class LazyPagesIterable<T> implements Iterable<T> {

    private final Supplier<? extends AsyncIterator<T>> streamFactory;

    /**
     * Creates a new LazyPagesIterable.
     *
     * @param streamFactory creates a new stream for every iteration
     */
    public LazyPagesIterable(Supplier<? extends AsyncIterator<T>> streamFactory) {
        this.streamFactory = streamFactory;
    }

    /**
     * Returns a fresh iterator over a new stream.
     *
     * @return a new iterator starting from the first page
     */
    @Override
    public Iterator<T> iterator() {
        return new BlockingIterator<>(streamFactory.get());
    }
}
