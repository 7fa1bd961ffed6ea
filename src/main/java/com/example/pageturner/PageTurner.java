package com.example.pageturner;

import com.example.pageturner.async.iterator.OrderedPagesAheadIterator;
import com.example.pageturner.async.iterator.PagesIterator;
import com.example.pageturner.async.iterator.SequentialPagesIterator;
import com.example.pageturner.async.iterator.UnorderedPagesAheadIterator;
import com.example.pageturner.config.PagesAheadConfig;

import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * A paginated data source: fetches one page for a request.
 *
 * <p>Implement {@link #turnPage} and get lazy page streams for free:
 * <pre>{@code
 * PageTurner<GetContentRequest, BlogRecord> blog = request -> client.getContent(request)
 *     .thenApply(response -> TurnedPage.of(List.of(response.record()), response.nextRequest()));
 *
 * // One request at a time, each next request taken from the previous response
 * List<BlogRecord> all = blog.pages(new GetContentRequest(0)).items().collectAsync().join();
 *
 * // Up to 5 requests in flight, results in request order
 * blog.pagesAhead(5, Limit.none(), new GetContentRequest(0), GetContentRequest::next)
 *     .items()
 *     .forEachAsync(this::process);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> look-ahead streams call {@link #turnPage} concurrently for
 * different requests, so implementations must be safe for concurrent use.
 *
 * @param <R> the request type
 * @param <T> the type of items in each page
 */
@FunctionalInterface
public interface PageTurner<R, T> {

    /**
     * Fetches the page for {@code request}.
     *
     * <p>A failed fetch is reported by completing the future exceptionally. Throwing
     * from this method is treated the same way.
     *
     * @param request the request of the page to fetch
     * @return a future completing with the items and the optional next request
     */
    CompletableFuture<TurnedPage<R, T>> turnPage(R request);

    /**
     * Returns a stream of pages that fetches one page at a time, taking every next
     * request from the previous response.
     *
     * @param request the request of the first page
     */
    default PagesIterator<T> pages(R request) {
        return new SequentialPagesIterator<>(this, request);
    }

    /**
     * Returns a stream of pages that keeps up to {@code requestsAheadCount} requests in
     * flight and yields pages in request order.
     *
     * @param requestsAheadCount window size, 0 yields an empty stream
     * @param limit cap on the total number of requests
     * @param request the request of the first page
     * @param nextRequest pure function deriving the request of the following page
     */
    default PagesIterator<T> pagesAhead(
            int requestsAheadCount,
            Limit limit,
            R request,
            UnaryOperator<R> nextRequest
    ) {
        return pagesAhead(PagesAheadConfig.of(requestsAheadCount, limit), request, nextRequest);
    }

    /**
     * Same as {@link #pagesAhead(int, Limit, Object, UnaryOperator)} with a full configuration.
     */
    default PagesIterator<T> pagesAhead(PagesAheadConfig config, R request, UnaryOperator<R> nextRequest) {
        return new OrderedPagesAheadIterator<>(this, config, request, nextRequest);
    }

    /**
     * Returns a stream of pages that keeps up to {@code requestsAheadCount} requests in
     * flight and yields pages as soon as they arrive.
     *
     * <p>Errors of requests that turn out to be past the last page are discarded.
     *
     * @param requestsAheadCount window size, 0 yields an empty stream
     * @param limit cap on the total number of requests
     * @param request the request of the first page
     * @param nextRequest pure function deriving the request of the following page
     */
    default PagesIterator<T> pagesAheadUnordered(
            int requestsAheadCount,
            Limit limit,
            R request,
            UnaryOperator<R> nextRequest
    ) {
        return pagesAheadUnordered(PagesAheadConfig.of(requestsAheadCount, limit), request, nextRequest);
    }

    /**
     * Same as {@link #pagesAheadUnordered(int, Limit, Object, UnaryOperator)} with a full configuration.
     */
    default PagesIterator<T> pagesAheadUnordered(
            PagesAheadConfig config,
            R request,
            UnaryOperator<R> nextRequest
    ) {
        return new UnorderedPagesAheadIterator<>(this, config, request, nextRequest);
    }
}
