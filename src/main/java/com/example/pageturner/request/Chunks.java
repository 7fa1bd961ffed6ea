package com.example.pageturner.request;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Groups the elements of an iterator into batches of a fixed size.
 *
 * <p>Chunks are lazy views: a chunk pulls elements from the underlying iterator
 * only as it is iterated, and stops after {@code chunkSize} elements even if the
 * source has more. Remaining elements stay available for the next chunk or for
 * {@link #nextItem()}.
 *
 * <p>Example usage:
 * <pre>{@code
 * Chunks<Integer> chunks = new Chunks<>(List.of(1, 2, 3, 4, 5).iterator(), 2);
 * chunks.nextChunk(); // [1, 2]
 * chunks.nextItem();  // 3
 * chunks.nextChunk(); // [4, 5]
 * chunks.nextChunk(); // empty
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe.
 *
 * @param <E> the type of elements
 */
public class Chunks<E> {

    private final Iterator<E> source;
    private final int chunkSize;

    /**
     * Creates a new Chunks view.
     *
     * @param source the elements to group
     * @param chunkSize maximum number of elements per chunk, 0 yields no chunks at all
     * @throws IllegalArgumentException if {@code chunkSize} is negative
     */
    public Chunks(Iterator<E> source, int chunkSize) {
        if (chunkSize < 0) {
            throw new IllegalArgumentException("chunkSize must be >= 0, got " + chunkSize);
        }
        this.source = Objects.requireNonNull(source, "source");
        this.chunkSize = chunkSize;
    }

    /**
     * Returns the next chunk, or empty if the chunk size is 0 or the source is exhausted.
     *
     * <p>A returned chunk always contains at least one element.
     */
    public Optional<Iterator<E>> nextChunk() {
        if (chunkSize == 0 || !source.hasNext()) {
            return Optional.empty();
        }
        return Optional.of(new Chunk(source.next()));
    }

    /**
     * Pulls a single element from the source, ignoring chunk boundaries.
     */
    public Optional<E> nextItem() {
        return source.hasNext() ? Optional.of(source.next()) : Optional.empty();
    }

    private final class Chunk implements Iterator<E> {

        private E first;
        private int yielded = 0;

        private Chunk(E first) {
            this.first = first;
        }

        @Override
        public boolean hasNext() {
            if (yielded >= chunkSize) {
                return false;
            }
            return first != null || source.hasNext();
        }

        @Override
        public E next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Chunk is exhausted");
            }
            yielded++;
            if (first != null) {
                E element = first;
                first = null;
                return element;
            }
            return source.next();
        }
    }
}
