package com.example.pageturner.reactor;

import com.example.pageturner.PageTurner;
import com.example.pageturner.TurnedPage;
import com.example.pageturner.async.iterator.AsyncIterator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Bridges between page streams and Project Reactor.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Stream items with backpressure, pulling one element per downstream request
 * Flux<BlogRecord> records = ReactorPages.flux(
 *     () -> PageTurners.pagesAhead(blog, 5, Limit.none(), new GetContentRequest(0)).items()
 * );
 *
 * records.take(10)           // cancels outstanding fetches after 10 items
 *     .collectList()
 *     .block();
 *
 * // Reactive fetch function as a page turner
 * PageTurner<GetContentRequest, BlogRecord> turner =
 *     ReactorPages.pageTurner(request -> webClient.get()...bodyToMono(...).map(this::toTurnedPage));
 * }</pre>
 *
 * <h2>Comparison with AsyncIterator</h2>
 * <table>
 *   <tr><th>Aspect</th><th>AsyncIterator</th><th>Flux</th></tr>
 *   <tr><td>Pull</td><td>nextAsync()</td><td>request(n)</td></tr>
 *   <tr><td>Early exit</td><td>cancel()</td><td>take(), dispose()</td></tr>
 *   <tr><td>Operators</td><td>forEachAsync(), collectAsync()</td><td>Rich (filter, map, reduce, etc.)</td></tr>
 * </table>
 */
public final class ReactorPages {

    private ReactorPages() {
    }

    /**
     * Returns a cold Flux: every subscription gets a fresh iterator from the supplier.
     * Cancelling the subscription cancels the iterator.
     *
     * @param iteratorFactory creates the iterator for one subscription
     */
    public static <T> Flux<T> flux(Supplier<? extends AsyncIterator<T>> iteratorFactory) {
        Objects.requireNonNull(iteratorFactory, "iteratorFactory");
        return Flux.defer(() -> flux(iteratorFactory.get()));
    }

    /**
     * Returns a Flux over the remaining elements of {@code iterator}. Since the iterator is
     * single-pass, the returned Flux must be subscribed at most once.
     */
    public static <T> Flux<T> flux(AsyncIterator<T> iterator) {
        Objects.requireNonNull(iterator, "iterator");
        return Mono.fromFuture(iterator::nextAsync)
                .repeat()
                .takeWhile(Optional::isPresent)
                .map(Optional::get)
                .doOnCancel(iterator::cancel);
    }

    /**
     * Adapts a reactive fetch function to a {@link PageTurner}. Each request subscribes to
     * the Mono returned for it; an empty Mono fails the fetch.
     *
     * @param fetch reactive fetch of one page
     */
    public static <R, T> PageTurner<R, T> pageTurner(Function<R, Mono<TurnedPage<R, T>>> fetch) {
        Objects.requireNonNull(fetch, "fetch");
        return request -> fetch.apply(request)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                        "Fetch completed without a page for request: " + request)))
                .toFuture();
    }
}
