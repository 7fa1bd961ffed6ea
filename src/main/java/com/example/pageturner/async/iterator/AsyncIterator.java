package com.example.pageturner.async.iterator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A pull-driven asynchronous sequence, the common shape of every page stream.
 *
 * <p>Each {@link #nextAsync()} call asks for one element and gets a future for it.
 * The future completes with an element, with {@code Optional.empty()} at the end of the
 * sequence, or exceptionally with the terminal error of the stream:
 * <pre>{@code
 * AsyncIterator<BlogRecord> records = blog.pages(new GetContentRequest(0)).items();
 *
 * // Drain without blocking
 * records.forEachAsync(this::index)
 *     .whenComplete((done, error) -> log.info("indexing finished", error));
 *
 * // Pull a single element, e.g. in tests
 * Optional<BlogRecord> first = records.nextAsync().join();
 * }</pre>
 *
 * <p>Rules every implementation follows:
 * <ul>
 *   <li>A new {@code nextAsync()} call must wait until the previous future completed;
 *       an overlapping call fails with {@link IllegalStateException}</li>
 *   <li>After the terminal error was delivered, the iterator is poisoned and further
 *       calls complete with {@code Optional.empty()}</li>
 *   <li>{@link #cancel()} stops the stream from any thread</li>
 * </ul>
 *
 * @param <T> the type of elements
 */
public interface AsyncIterator<T> {

    /**
     * Requests the next element.
     *
     * @return a future completing with the next element, with {@code Optional.empty()}
     *         when the stream is exhausted or cancelled, or exceptionally with the
     *         terminal error
     */
    CompletableFuture<Optional<T>> nextAsync();

    /**
     * Pulls every remaining element and hands it to {@code action}.
     *
     * @param action called once per element, in iteration order
     * @return a future completing when the stream is exhausted, or exceptionally with
     *         its terminal error
     */
    default CompletableFuture<Void> forEachAsync(Consumer<? super T> action) {
        return nextAsync().thenCompose(next -> {
            if (next.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            action.accept(next.get());
            return forEachAsync(action);
        });
    }

    /**
     * Pulls every remaining element into a list.
     */
    default CompletableFuture<List<T>> collectAsync() {
        List<T> collected = new ArrayList<>();
        return forEachAsync(collected::add).thenApply(ignored -> collected);
    }

    /**
     * Stops the stream. Outstanding fetches are cancelled, no new fetch is issued and
     * a pending or later {@code nextAsync()} completes with {@code Optional.empty()}.
     */
    void cancel();

    boolean isCancelled();
}
