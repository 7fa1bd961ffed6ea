package com.example.pageturner.streaming.spliterator;

import com.example.pageturner.async.iterator.AsyncIterator;
import com.example.pageturner.iterable.iterator.BlockingIterator;

import java.util.Spliterator;
import java.util.function.Consumer;

/**
 * A Spliterator that pulls elements from an {@link AsyncIterator}, blocking on each one.
 *
 * <p>This is the bridge from page streams to the Java Stream API:
 * <pre>{@code
 * Spliterator<Integer> spliterator = new AsyncIteratorSpliterator<>(
 *     numbers.pages(new GetNumbersQuery(0)).items()
 * );
 *
 * Stream<Integer> stream = StreamSupport.stream(spliterator, false);
 * }</pre>
 *
 * <p>Pages are only fetched as elements are consumed, so short-circuiting operations
 * such as {@code limit()} or {@code findFirst()} stop fetching early.
 *
 * @param <T> the type of elements
 */
public class AsyncIteratorSpliterator<T> implements Spliterator<T> {

    private final BlockingIterator<T> iterator;
    private final int characteristics;

    /**
     * Creates a new AsyncIteratorSpliterator.
     *
     * @param source the stream to pull from
     * @param ordered whether the source yields elements in a meaningful order
     */
    public AsyncIteratorSpliterator(AsyncIterator<T> source, boolean ordered) {
        this.iterator = new BlockingIterator<>(source);
        this.characteristics = ordered ? ORDERED | NONNULL : NONNULL;
    }

    public AsyncIteratorSpliterator(AsyncIterator<T> source) {
        this(source, true);
    }

    @Override
    public boolean tryAdvance(Consumer<? super T> action) {
        if (!iterator.hasNext()) {
            return false;
        }
        action.accept(iterator.next());
        return true;
    }

    /**
     * Returns null: elements come from a single sequential stream and can't be split.
     *
     * @return null (splitting not supported)
     */
    @Override
    public Spliterator<T> trySplit() {
        return null;
    }

    /**
     * Returns an estimate of the number of remaining elements.
     * Since we don't know the total count, we return MAX_VALUE.
     */
    @Override
    public long estimateSize() {
        return Long.MAX_VALUE;
    }

    /**
     * NOT SIZED because we don't know the total count upfront.
     */
    @Override
    public int characteristics() {
        return characteristics;
    }

    /**
     * Cancels the underlying stream.
     */
    public void close() {
        iterator.close();
    }
}
