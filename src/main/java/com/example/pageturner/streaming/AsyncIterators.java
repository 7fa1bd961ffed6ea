package com.example.pageturner.streaming;

import com.example.pageturner.async.iterator.AsyncIterator;
import com.example.pageturner.iterable.iterator.BlockingIterator;
import com.example.pageturner.streaming.spliterator.AsyncIteratorSpliterator;

import java.util.Iterator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Blocking views of {@link AsyncIterator}s.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (Stream<BlogRecord> records = AsyncIterators.stream(
 *         PageTurners.pagesAheadUnordered(blog, 8, Limit.none(), new GetContentRequest(0)).items())) {
 *     long count = records.filter(BlogRecord::isPublished).count();
 * }
 * }</pre>
 */
public final class AsyncIterators {

    private AsyncIterators() {
    }

    /**
     * Returns a sequential Stream over the remaining elements. Closing the stream cancels
     * the iterator.
     */
    public static <T> Stream<T> stream(AsyncIterator<T> iterator) {
        AsyncIteratorSpliterator<T> spliterator = new AsyncIteratorSpliterator<>(iterator);
        return StreamSupport.stream(spliterator, false).onClose(spliterator::close);
    }

    /**
     * Returns a blocking Iterator over the remaining elements.
     */
    public static <T> Iterator<T> toIterator(AsyncIterator<T> iterator) {
        return new BlockingIterator<>(iterator);
    }
}
