package com.example.pageturner.async.iterator;

import com.example.pageturner.PageFetchException;
import com.example.pageturner.PageTurner;
import com.example.pageturner.TurnedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A {@link PagesIterator} that fetches one page at a time.
 *
 * <p>The request for every page after the first is taken from the previous response,
 * so requests don't need to be chainable. Iteration ends after a page without a next
 * request.
 *
 * <p>Key behaviors:
 * <ul>
 *   <li>No page is fetched before the first {@code nextAsync()} call</li>
 *   <li>Exactly one fetch is in flight at a time, pages come in request order</li>
 *   <li>The first failure is terminal: it is reported once, then the iterator is exhausted</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * PagesIterator<Integer> pages = new SequentialPagesIterator<>(numbersClient, new GetNumbersQuery(0));
 * pages.forEachAsync(page -> System.out.println(page.size() + " numbers"));
 * }</pre>
 *
 * @param <R> the request type
 * @param <T> the type of items in each page
 */
public class SequentialPagesIterator<R, T> implements PagesIterator<T> {

    private static final Logger log = LoggerFactory.getLogger(SequentialPagesIterator.class);

    private final PageTurner<R, T> pageTurner;

    private final AtomicBoolean stepInProgress = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile CompletableFuture<TurnedPage<R, T>> inFlight;
    private R nextRequest;
    private volatile boolean finished = false;

    /**
     * Creates a new SequentialPagesIterator.
     *
     * @param pageTurner fetches the pages
     * @param request the request of the first page
     */
    public SequentialPagesIterator(PageTurner<R, T> pageTurner, R request) {
        this.pageTurner = Objects.requireNonNull(pageTurner, "pageTurner");
        this.nextRequest = Objects.requireNonNull(request, "request");
    }

    @Override
    public CompletableFuture<Optional<List<T>>> nextAsync() {
        if (cancelled.get() || finished) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!stepInProgress.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "nextAsync() called before the previous call completed"));
        }

        // The previous page had no next request
        if (nextRequest == null) {
            finished = true;
            return complete(new CompletableFuture<>(), Optional.empty());
        }

        R request = nextRequest;
        CompletableFuture<Optional<List<T>>> result = new CompletableFuture<>();
        CompletableFuture<TurnedPage<R, T>> fetch = Futures.turnPage(pageTurner, request);
        inFlight = fetch;

        fetch.whenComplete((page, ex) -> {
            inFlight = null;
            if (cancelled.get()) {
                complete(result, Optional.empty());
                return;
            }

            if (ex != null) {
                finished = true;
                nextRequest = null;
                stepInProgress.set(false);
                result.completeExceptionally(new PageFetchException(request, Futures.unwrap(ex)));
                return;
            }

            nextRequest = page.nextRequest().orElse(null);
            if (nextRequest == null) {
                log.debug("Last page reached with request {}", request);
            }
            complete(result, Optional.of(page.items()));
        });

        return result;
    }

    private CompletableFuture<Optional<List<T>>> complete(
            CompletableFuture<Optional<List<T>>> result,
            Optional<List<T>> value
    ) {
        stepInProgress.set(false);
        result.complete(value);
        return result;
    }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            CompletableFuture<TurnedPage<R, T>> fetch = inFlight;
            if (fetch != null) {
                fetch.cancel(false);
            }
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Returns true if iteration has finished (either completed, failed or cancelled).
     */
    public boolean isFinished() {
        return finished || cancelled.get();
    }
}
