package com.example.pageturner.async.iterator;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Flattens an {@link AsyncIterator} of pages into an {@link AsyncIterator} of items.
 *
 * <p>Pages are pulled only when the items of the current page are exhausted. Empty
 * pages are skipped without completing a future for them.
 *
 * @param <T> the type of items
 */
public class ItemsIterator<T> implements AsyncIterator<T> {

    private final AsyncIterator<List<T>> pages;
    private Iterator<T> currentPageIterator;

    public ItemsIterator(AsyncIterator<List<T>> pages) {
        this.pages = pages;
    }

    @Override
    public CompletableFuture<Optional<T>> nextAsync() {
        CompletableFuture<Optional<T>> result = new CompletableFuture<>();
        advance(result);
        return result;
    }

    private void advance(CompletableFuture<Optional<T>> result) {
        while (true) {
            if (currentPageIterator != null && currentPageIterator.hasNext()) {
                result.complete(Optional.of(currentPageIterator.next()));
                return;
            }

            CompletableFuture<Optional<List<T>>> nextPage = pages.nextAsync();
            if (nextPage.isDone() && !nextPage.isCompletedExceptionally()) {
                if (!acceptPage(nextPage.join(), result)) {
                    return;
                }
                continue;
            }

            nextPage.whenComplete((page, ex) -> {
                if (ex != null) {
                    result.completeExceptionally(ex);
                } else if (acceptPage(page, result)) {
                    advance(result);
                }
            });
            return;
        }
    }

    /**
     * @return true if iteration should continue with the accepted page
     */
    private boolean acceptPage(Optional<List<T>> page, CompletableFuture<Optional<T>> result) {
        if (page.isEmpty()) {
            currentPageIterator = null;
            result.complete(Optional.empty());
            return false;
        }
        currentPageIterator = page.get().iterator();
        return true;
    }

    @Override
    public void cancel() {
        pages.cancel();
    }

    @Override
    public boolean isCancelled() {
        return pages.isCancelled();
    }
}
