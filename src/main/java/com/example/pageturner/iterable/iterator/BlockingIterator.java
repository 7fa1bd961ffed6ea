package com.example.pageturner.iterable.iterator;

import com.example.pageturner.async.iterator.AsyncIterator;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * An Iterator that blocks on an {@link AsyncIterator}.
 *
 * <p>It ensures that:
 * <ul>
 *   <li>Elements are only requested when needed (lazy evaluation)</li>
 *   <li>{@link #hasNext()} blocks until the next element or the end of the stream is known</li>
 *   <li>A terminal error is rethrown unwrapped from {@link CompletionException}</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * Iterator<Integer> iterator = new BlockingIterator<>(numbers.pages(new GetNumbersQuery(0)).items());
 *
 * while (iterator.hasNext()) {
 *     Integer number = iterator.next();
 *     // Process number
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. It must be used from a single thread.
 *
 * @param <T> the type of elements
 */
public class BlockingIterator<T> implements Iterator<T> {

    private final AsyncIterator<T> source;

    private Optional<T> lookahead;
    private boolean finished = false;

    public BlockingIterator(AsyncIterator<T> source) {
        this.source = source;
    }

    /**
     * Returns {@code true} if there are more elements.
     *
     * <p>This method may block while the next page is fetched.
     *
     * @return {@code true} if there are more elements
     */
    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        if (lookahead == null) {
            lookahead = await();
        }
        if (lookahead.isEmpty()) {
            finished = true;
            return false;
        }
        return true;
    }

    /**
     * Returns the next element.
     *
     * @return the next element
     * @throws NoSuchElementException if no more elements are available
     */
    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more items available");
        }
        T element = lookahead.get();
        lookahead = null;
        return element;
    }

    private Optional<T> await() {
        try {
            return source.nextAsync().join();
        } catch (CompletionException e) {
            finished = true;
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } catch (CancellationException e) {
            finished = true;
            return Optional.empty();
        }
    }

    /**
     * Stops the iteration and cancels the underlying stream.
     */
    public void close() {
        finished = true;
        source.cancel();
    }
}
