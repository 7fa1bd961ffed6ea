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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

/**
 * A {@link PagesIterator} that keeps several requests in flight and yields pages as
 * soon as they arrive.
 *
 * <p>Scheduling is the same sliding window as in {@link OrderedPagesAheadIterator}, but
 * pages are emitted in completion order. Because requests are issued speculatively, a
 * window may straddle the true end of the data: requests past the last page fail only
 * because they query data that doesn't exist. Errors are therefore held back and
 * reconciled against the end of the data:
 * <ul>
 *   <li>A failure is never reported while the last page is unknown and other requests
 *       of the same wave are still in flight. Successful siblings are emitted meanwhile</li>
 *   <li>Only the error of the lowest-indexed failed request is retained</li>
 *   <li>Once a response declares the last page, pages and errors of requests with a
 *       higher index are discarded and the stream ends normally</li>
 *   <li>An error at or before the last page, or one left when the wave drains without
 *       revealing the last page, is terminal</li>
 * </ul>
 *
 * <p>No new requests are scheduled once an error is retained or the last page is known.
 *
 * <p><b>Thread Safety:</b> fetches may complete on any thread, but {@code nextAsync()}
 * must not be called before the previously returned future completed.
 *
 * @param <R> the request type
 * @param <T> the type of items in each page
 */
public class UnorderedPagesAheadIterator<R, T> implements PagesIterator<T> {

    private static final Logger log = LoggerFactory.getLogger(UnorderedPagesAheadIterator.class);

    private static final long UNKNOWN = -1;

    private final PageTurner<R, T> pageTurner;
    private final PagesAheadListener listener;
    private final Chunks<NumberedRequest<R>> numberedRequests;

    // Fetches not completed yet, keyed by request index
    private final Map<Long, CompletableFuture<TurnedPage<R, T>>> inFlight = new ConcurrentHashMap<>();

    // Completions not consumed by a step yet and the step waiting for one, guarded by lock
    private final Object lock = new Object();
    private final Deque<Completion<R, T>> completed = new ArrayDeque<>();
    private CompletableFuture<Completion<R, T>> waiter;

    private final AtomicBoolean stepInProgress = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    // Scheduled minus consumed, only touched by the step
    private int outstanding = 0;
    private long lastPageIndex = UNKNOWN;
    private RetainedError<R> retainedError;
    private volatile boolean finished = false;

    /**
     * Creates a new UnorderedPagesAheadIterator.
     *
     * @param pageTurner fetches the pages, called concurrently
     * @param config window size, limit and listener
     * @param request the request of the first page
     * @param nextRequest pure function deriving the request of the following page
     */
    public UnorderedPagesAheadIterator(
            PageTurner<R, T> pageTurner,
            PagesAheadConfig config,
            R request,
            UnaryOperator<R> nextRequest
    ) {
        this.pageTurner = Objects.requireNonNull(pageTurner, "pageTurner");
        this.listener = config.listener();
        this.numberedRequests = new Chunks<>(
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
        step(result);
        return result;
    }

    /**
     * Runs the state machine until it emits a page, ends or has to wait for a fetch.
     * Completions that are already available are consumed in a loop.
     */
    private void step(CompletableFuture<Optional<List<T>>> result) {
        while (true) {
            if (cancelled.get()) {
                complete(result, Optional.empty());
                return;
            }

            if (lastPageIndex != UNKNOWN) {
                if (outstanding == 0) {
                    reconcileEnd(result);
                    return;
                }
                // Drain what is still in flight, nothing new is scheduled
            } else if (retainedError != null) {
                if (outstanding == 0) {
                    // The wave drained without revealing the last page
                    fail(result, retainedError);
                    return;
                }
            } else if (!scheduleRequests()) {
                endOfStream(result);
                return;
            }

            CompletableFuture<Completion<R, T>> next = awaitCompletion();
            if (next.isDone()) {
                if (next.isCompletedExceptionally()) {
                    complete(result, Optional.empty());
                    return;
                }
                if (onCompletion(next.join(), result)) {
                    return;
                }
                continue;
            }

            next.whenComplete((completion, ex) -> {
                if (ex != null) {
                    // Only cancel() fails the waiter
                    complete(result, Optional.empty());
                } else if (!onCompletion(completion, result)) {
                    step(result);
                }
            });
            return;
        }
    }

    /**
     * Schedules a full chunk when nothing is outstanding, otherwise one refill request.
     *
     * @return false if nothing is outstanding and the request sequence is exhausted
     */
    private boolean scheduleRequests() {
        if (outstanding == 0) {
            Optional<Iterator<NumberedRequest<R>>> chunk = numberedRequests.nextChunk();
            if (chunk.isEmpty()) {
                return false;
            }
            chunk.get().forEachRemaining(this::schedule);
        } else {
            numberedRequests.nextItem().ifPresent(this::schedule);
        }
        return true;
    }

    private void schedule(NumberedRequest<R> numbered) {
        // cancel() may have run on another thread while this step was scheduling
        if (cancelled.get()) {
            return;
        }
        outstanding++;
        listener.onScheduled(numbered.index(), numbered.request());
        CompletableFuture<TurnedPage<R, T>> future = Futures.turnPage(pageTurner, numbered.request());
        inFlight.put(numbered.index(), future);
        if (cancelled.get()) {
            future.cancel(false);
        }
        future.whenComplete((page, ex) -> deliver(new Completion<>(numbered, page, ex)));
    }

    private void deliver(Completion<R, T> completion) {
        inFlight.remove(completion.request().index());
        CompletableFuture<Completion<R, T>> waiting;
        synchronized (lock) {
            if (waiter == null) {
                completed.addLast(completion);
                return;
            }
            waiting = waiter;
            waiter = null;
        }
        waiting.complete(completion);
    }

    private CompletableFuture<Completion<R, T>> awaitCompletion() {
        synchronized (lock) {
            Completion<R, T> completion = completed.pollFirst();
            if (completion != null) {
                return CompletableFuture.completedFuture(completion);
            }
            if (cancelled.get()) {
                return CompletableFuture.failedFuture(new CancellationException());
            }
            waiter = new CompletableFuture<>();
            return waiter;
        }
    }

    /**
     * Consumes one completion.
     *
     * @return true if the step is over (a page was emitted)
     */
    private boolean onCompletion(Completion<R, T> completion, CompletableFuture<Optional<List<T>>> result) {
        outstanding--;
        long index = completion.request().index();
        listener.onCompleted(index, completion.error() == null);

        if (cancelled.get()) {
            complete(result, Optional.empty());
            return true;
        }

        if (completion.error() != null) {
            retainError(index, completion.request().request(), Futures.unwrap(completion.error()));
            return false;
        }

        TurnedPage<R, T> page = completion.page();
        if (lastPageIndex != UNKNOWN && index > lastPageIndex) {
            log.debug("Dropping page #{} answered past the last page #{}", index, lastPageIndex);
            listener.onPageDiscarded(index);
            return false;
        }
        if (page.isLast() && (lastPageIndex == UNKNOWN || index < lastPageIndex)) {
            lastPageIndex = index;
            listener.onLastPage(index);
            log.debug("Page #{} is the last one, {} requests still outstanding", index, outstanding);
        }
        complete(result, Optional.of(page.items()));
        return true;
    }

    /**
     * Keeps the error of the lowest-indexed failed request.
     */
    private void retainError(long index, R request, Throwable error) {
        if (retainedError == null || index < retainedError.index()) {
            retainedError = new RetainedError<>(index, request, error);
            listener.onErrorRetained(index, error);
        }
    }

    private void reconcileEnd(CompletableFuture<Optional<List<T>>> result) {
        RetainedError<R> error = retainedError;
        if (error != null && error.index() <= lastPageIndex) {
            fail(result, error);
            return;
        }
        if (error != null) {
            log.debug("Discarding error of page #{} past the last page #{}", error.index(), lastPageIndex);
            listener.onErrorDiscarded(error.index(), error.error());
            retainedError = null;
        }
        endOfStream(result);
    }

    private void fail(CompletableFuture<Optional<List<T>>> result, RetainedError<R> error) {
        finished = true;
        retainedError = null;
        cancelInFlight();
        listener.onTerminated(true);
        stepInProgress.set(false);
        result.completeExceptionally(new PageFetchException(error.request(), error.index(), error.error()));
    }

    private void endOfStream(CompletableFuture<Optional<List<T>>> result) {
        finished = true;
        cancelInFlight();
        listener.onTerminated(false);
        complete(result, Optional.empty());
    }

    private void complete(CompletableFuture<Optional<List<T>>> result, Optional<List<T>> value) {
        stepInProgress.set(false);
        result.complete(value);
    }

    private void cancelInFlight() {
        for (CompletableFuture<TurnedPage<R, T>> future : new ArrayList<>(inFlight.values())) {
            future.cancel(false);
        }
        inFlight.clear();
    }

    @Override
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        finished = true;
        cancelInFlight();

        CompletableFuture<Completion<R, T>> waiting;
        synchronized (lock) {
            completed.clear();
            waiting = waiter;
            waiter = null;
        }
        if (waiting != null) {
            waiting.cancel(false);
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    private record Completion<R, T>(NumberedRequest<R> request, TurnedPage<R, T> page, Throwable error) {
    }

    private record RetainedError<R>(long index, R request, Throwable error) {
    }
}
