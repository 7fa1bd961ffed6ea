package com.example.pageturner.async.iterator;

import java.util.List;

/**
 * An {@link AsyncIterator} over whole pages.
 *
 * <p>Each element is the item list of one fetched page. Use {@link #items()} to
 * iterate over individual items instead.
 *
 * @param <T> the type of items in each page
 */
public interface PagesIterator<T> extends AsyncIterator<List<T>> {

    /**
     * Returns a view of this stream that yields the items of every page one by one.
     *
     * <p>The view shares state with this iterator: pulling from one advances the other,
     * and cancelling the view cancels this iterator.
     */
    default AsyncIterator<T> items() {
        return new ItemsIterator<>(this);
    }
}
