package com.example.pageturner.async.iterator;

import com.example.pageturner.PageTurner;
import com.example.pageturner.TurnedPage;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Futures {

    private Futures() {
    }

    /**
     * Calls the page turner, turning a synchronous throw or a null future into a failed future.
     */
    static <R, T> CompletableFuture<TurnedPage<R, T>> turnPage(PageTurner<R, T> pageTurner, R request) {
        try {
            CompletableFuture<TurnedPage<R, T>> future = pageTurner.turnPage(request);
            if (future == null) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Page turner returned no future for request: " + request));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Strips the wrappers CompletableFuture adds around the original failure.
     */
    static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
