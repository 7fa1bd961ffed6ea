package com.example.pageturner.async.listener;

/**
 * Observer of look-ahead scheduling events.
 *
 * <p>All methods default to doing nothing, so implementations override only the
 * events they care about. Callbacks are invoked from the scheduler step or from
 * the thread that completed a fetch; implementations must be cheap and must not
 * call back into the iterator.
 *
 * <p>Example usage:
 * <pre>{@code
 * PagesAheadListener counting = new PagesAheadListener() {
 *     @Override
 *     public void onScheduled(long index, Object request) {
 *         scheduled.incrementAndGet();
 *     }
 * };
 * }</pre>
 */
public interface PagesAheadListener {

    /**
     * A request was handed to the page turner.
     *
     * @param index position of the request in the request chain
     * @param request the scheduled request
     */
    default void onScheduled(long index, Object request) {
    }

    /**
     * The fetch of a request finished and its outcome was consumed by the scheduler.
     */
    default void onCompleted(long index, boolean success) {
    }

    /**
     * A response declared that the page at {@code index} is the last one.
     */
    default void onLastPage(long index) {
    }

    /**
     * A failed fetch was held back while the end of the data is still unknown.
     */
    default void onErrorRetained(long index, Throwable error) {
    }

    /**
     * A retained error was dropped because it came from a request past the last page.
     */
    default void onErrorDiscarded(long index, Throwable error) {
    }

    /**
     * A page was dropped because its request came after the last page.
     */
    default void onPageDiscarded(long index) {
    }

    /**
     * The stream ended, either normally or with a terminal error.
     *
     * @param failed {@code true} if the stream ended with an error
     */
    default void onTerminated(boolean failed) {
    }

    /**
     * Returns a listener that ignores every event.
     */
    static PagesAheadListener noop() {
        return NoopListener.INSTANCE;
    }

    /**
     * Returns a listener forwarding every event to both listeners.
     */
    default PagesAheadListener andThen(PagesAheadListener other) {
        PagesAheadListener self = this;
        return new PagesAheadListener() {
            @Override
            public void onScheduled(long index, Object request) {
                self.onScheduled(index, request);
                other.onScheduled(index, request);
            }

            @Override
            public void onCompleted(long index, boolean success) {
                self.onCompleted(index, success);
                other.onCompleted(index, success);
            }

            @Override
            public void onLastPage(long index) {
                self.onLastPage(index);
                other.onLastPage(index);
            }

            @Override
            public void onErrorRetained(long index, Throwable error) {
                self.onErrorRetained(index, error);
                other.onErrorRetained(index, error);
            }

            @Override
            public void onErrorDiscarded(long index, Throwable error) {
                self.onErrorDiscarded(index, error);
                other.onErrorDiscarded(index, error);
            }

            @Override
            public void onPageDiscarded(long index) {
                self.onPageDiscarded(index);
                other.onPageDiscarded(index);
            }

            @Override
            public void onTerminated(boolean failed) {
                self.onTerminated(failed);
                other.onTerminated(failed);
            }
        };
    }

    final class NoopListener implements PagesAheadListener {
        private static final NoopListener INSTANCE = new NoopListener();

        private NoopListener() {
        }
    }
}
