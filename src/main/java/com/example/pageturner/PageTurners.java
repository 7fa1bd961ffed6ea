package com.example.pageturner;

import com.example.pageturner.async.iterator.PagesIterator;
import com.example.pageturner.config.PagesAheadConfig;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Static factories for {@link PageTurner} adapters and for look-ahead streams over
 * requests implementing {@link RequestAhead}.
 */
public final class PageTurners {

    private PageTurners() {
    }

    /**
     * A page fetch that blocks the calling thread.
     *
     * @param <R> the request type
     * @param <T> the type of items in each page
     */
    @FunctionalInterface
    public interface BlockingPageTurner<R, T> {
        TurnedPage<R, T> turnPage(R request) throws Exception;
    }

    /**
     * Adapts a blocking fetch: every request runs on {@code executor}, so several pages
     * can be fetched concurrently by the look-ahead streams.
     *
     * @param fetch the blocking fetch
     * @param executor where fetches run
     */
    public static <R, T> PageTurner<R, T> blocking(BlockingPageTurner<R, T> fetch, Executor executor) {
        Objects.requireNonNull(fetch, "fetch");
        Objects.requireNonNull(executor, "executor");
        return request -> CompletableFuture.supplyAsync(() -> {
            try {
                return fetch.turnPage(request);
            } catch (RuntimeException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Adapts a shared handle: every request is delegated to the page turner the
     * handle currently provides. The handle is resolved per request and never copied.
     *
     * @param handle provides the shared page turner
     */
    public static <R, T> PageTurner<R, T> shared(Supplier<? extends PageTurner<R, T>> handle) {
        Objects.requireNonNull(handle, "handle");
        return request -> handle.get().turnPage(request);
    }

    /**
     * Ordered look-ahead stream over a chainable request.
     *
     * @see PageTurner#pagesAhead(int, Limit, Object, java.util.function.UnaryOperator)
     */
    public static <R extends RequestAhead<R>, T> PagesIterator<T> pagesAhead(
            PageTurner<R, T> pageTurner,
            int requestsAheadCount,
            Limit limit,
            R request
    ) {
        return pageTurner.pagesAhead(requestsAheadCount, limit, request, RequestAhead::nextRequest);
    }

    public static <R extends RequestAhead<R>, T> PagesIterator<T> pagesAhead(
            PageTurner<R, T> pageTurner,
            PagesAheadConfig config,
            R request
    ) {
        return pageTurner.pagesAhead(config, request, RequestAhead::nextRequest);
    }

    /**
     * Unordered look-ahead stream over a chainable request.
     *
     * @see PageTurner#pagesAheadUnordered(int, Limit, Object, java.util.function.UnaryOperator)
     */
    public static <R extends RequestAhead<R>, T> PagesIterator<T> pagesAheadUnordered(
            PageTurner<R, T> pageTurner,
            int requestsAheadCount,
            Limit limit,
            R request
    ) {
        return pageTurner.pagesAheadUnordered(requestsAheadCount, limit, request, RequestAhead::nextRequest);
    }

    public static <R extends RequestAhead<R>, T> PagesIterator<T> pagesAheadUnordered(
            PageTurner<R, T> pageTurner,
            PagesAheadConfig config,
            R request
    ) {
        return pageTurner.pagesAheadUnordered(config, request, RequestAhead::nextRequest);
    }
}
