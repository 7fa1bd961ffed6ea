package com.example.pageturner.async.iterator;

import com.example.pageturner.PageFetchException;
import com.example.pageturner.PageTurner;
import com.example.pageturner.TurnedPage;
import com.example.pageturner.async.listener.PagesAheadListener;
import com.example.pageturner.config.PagesAheadConfig;
import com.example.pageturner.request.Chunks;
import com.example.pageturner.request.NumberedRequest;
import com.example.pageturner.request.RequestIter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * A {@link PagesIterator} that keeps several requests in flight and yields pages in
 * request order.
 *
 * <p>Requests are derived from the first one with a pure chain function, never from
 * responses, so up to {@code requestsAheadCount} of them can be issued before it is
 * known whether an earlier page is the last one. The window works like this:
 * <ul>
 *   <li>When nothing is in flight, a whole chunk of {@code requestsAheadCount} requests
 *       is scheduled at once</li>
 *   <li>Otherwise exactly one request is added per emitted page (sliding window refill)</li>
 *   <li>The oldest request is always awaited first, even if a later one completes earlier</li>
 *   <li>A page without a next request ends the stream; requests past it are cancelled</li>
 *   <li>The first failure in request order is terminal</li>
 * </ul>
 *
 * <p>Speculative requests past the last page are wasted work. Cap them with
 * {@link com.example.pageturner.Limit#pages(int)} when the page count is known.
 *
 * <p><b>Thread Safety:</b> fetches may complete on any thread, but {@code nextAsync()}
 * must not be called before the previously returned future completed.
 *
 * @param <R> the request type
 * @param <T> the type of items in each page
 */
public class OrderedPagesAheadIterator<R, T> implements PagesIterator<T> {

    private static final Logger log = LoggerFactory.getLogger(OrderedPagesAheadIterator.class);

    private final PageTurner<R, T> pageTurner;
    private final PagesAheadListener listener;
    private final Chunks<NumberedRequest<R>> requests;
    private final ConcurrentLinkedDeque<InFlight<R, T>> inProgress = new ConcurrentLinkedDeque<>();

    private final AtomicBoolean stepInProgress = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile boolean lastPageQueried = false;
    private volatile boolean finished = false;

    /**
     * Creates a new OrderedPagesAheadIterator.
     *
     * @param pageTurner fetches the pages, called concurrently
     * @param config window size, limit and listener
     * @param request the request of the first page
     * @param nextRequest pure function deriving the request of the following page
     */
    public OrderedPagesAheadIterator(
            PageTurner<R, T> pageTurner,
            PagesAheadConfig config,
            R request,
            UnaryOperator<R> nextRequest
    ) {
        this.pageTurner = Objects.requireNonNull(pageTurner, "pageTurner");
        this.listener = config.listener();
        this.requests = new Chunks<>(
                new RequestIter<>(request, nextRequest, config.limit()).numbered(),
                config.requestsAheadCount()
        );
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

        CompletableFuture<Optional<List<T>>> result = new CompletableFuture<>();

        if (lastPageQueried) {
            endOfStream(result);
            return result;
        }

        if (inProgress.isEmpty()) {
            Optional<Iterator<NumberedRequest<R>>> chunk = requests.nextChunk();
            if (chunk.isEmpty()) {
                endOfStream(result);
                return result;
            }
            chunk.get().forEachRemaining(this::schedule);
        } else {
            // The head completed on the previous step, keep the window full
            requests.nextItem().ifPresent(this::schedule);
        }

        InFlight<R, T> head = inProgress.peekFirst();
        head.future().whenComplete((page, ex) -> onHeadCompleted(head, page, ex, result));
        return result;
    }

    private void schedule(NumberedRequest<R> numbered) {
        listener.onScheduled(numbered.index(), numbered.request());
        CompletableFuture<TurnedPage<R, T>> future = Futures.turnPage(pageTurner, numbered.request());
        inProgress.addLast(new InFlight<>(numbered, future));
    }

    private void onHeadCompleted(
            InFlight<R, T> head,
            TurnedPage<R, T> page,
            Throwable ex,
            CompletableFuture<Optional<List<T>>> result
    ) {
        if (cancelled.get()) {
            complete(result, Optional.empty());
            return;
        }

        inProgress.remove(head);
        long index = head.request().index();
        listener.onCompleted(index, ex == null);

        if (ex != null) {
            Throwable cause = Futures.unwrap(ex);
            log.debug("Page #{} failed, abandoning {} in-flight requests", index, inProgress.size());
            finished = true;
            cancelInProgress();
            listener.onTerminated(true);
            stepInProgress.set(false);
            result.completeExceptionally(new PageFetchException(head.request().request(), index, cause));
            return;
        }

        if (page.isLast()) {
            lastPageQueried = true;
            listener.onLastPage(index);
            if (!inProgress.isEmpty()) {
                log.debug("Page #{} is the last one, cancelling {} requests past it", index, inProgress.size());
                cancelInProgress();
            }
        }
        complete(result, Optional.of(page.items()));
    }

    private void endOfStream(CompletableFuture<Optional<List<T>>> result) {
        finished = true;
        cancelInProgress();
        listener.onTerminated(false);
        complete(result, Optional.empty());
    }

    private void complete(CompletableFuture<Optional<List<T>>> result, Optional<List<T>> value) {
        stepInProgress.set(false);
        result.complete(value);
    }

    private void cancelInProgress() {
        InFlight<R, T> inFlight;
        while ((inFlight = inProgress.pollFirst()) != null) {
            inFlight.future().cancel(false);
        }
    }

    @Override
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            finished = true;
            cancelInProgress();
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Returns the number of requests currently in flight.
     */
    public int inFlightCount() {
        return inProgress.size();
    }

    private record InFlight<R, T>(NumberedRequest<R> request, CompletableFuture<TurnedPage<R, T>> future) {
    }
}
