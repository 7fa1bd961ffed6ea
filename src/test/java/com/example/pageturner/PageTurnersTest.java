package com.example.pageturner;

import com.example.pageturner.support.BlogClient;
import com.example.pageturner.support.BlogClient.BlogRecord;
import com.example.pageturner.support.BlogClient.GetContentRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageTurnersTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    // =========================================================================
    // BLOCKING ADAPTER
    // =========================================================================

    @Test
    @DisplayName("Should run blocking fetches on the executor")
    void shouldRunBlockingFetchesOnExecutor() {
        AtomicReference<String> fetchThread = new AtomicReference<>();
        PageTurner<Integer, Integer> turner = PageTurners.blocking(page -> {
            fetchThread.set(Thread.currentThread().getName());
            return page < 2 ? TurnedPage.next(List.of(page), page + 1) : TurnedPage.last(List.of(page));
        }, executor);

        List<Integer> items = turner.pagesAhead(2, Limit.none(), 0, page -> page + 1)
                .items()
                .collectAsync()
                .join();

        assertThat(items).containsExactly(0, 1, 2);
        assertThat(fetchThread.get()).isNotEqualTo(Thread.currentThread().getName());
    }

    @Test
    @DisplayName("Should surface checked exceptions of blocking fetches as the cause of the page error")
    void shouldWrapCheckedExceptions() {
        PageTurner<Integer, Integer> turner = PageTurners.blocking(page -> {
            throw new IOException("connection reset");
        }, executor);

        assertThatThrownBy(() -> turner.pages(0).nextAsync().join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(PageFetchException.class)
                .cause()
                .isInstanceOf(IOException.class)
                .hasMessage("connection reset");
    }

    // =========================================================================
    // SHARED HANDLE
    // =========================================================================

    @Test
    @DisplayName("Should resolve the shared page turner for every request")
    void shouldResolveSharedHandlePerRequest() {
        AtomicReference<PageTurner<GetContentRequest, BlogRecord>> handle =
                new AtomicReference<>(new BlogClient(3));
        PageTurner<GetContentRequest, BlogRecord> shared = PageTurners.shared(handle::get);

        assertThat(shared.pages(new GetContentRequest(0)).items().collectAsync().join()).hasSize(3);

        // Swapping the handle affects streams created afterwards
        handle.set(new BlogClient(5));
        assertThat(PageTurners.pagesAhead(shared, 2, Limit.none(), new GetContentRequest(0))
                .items()
                .collectAsync()
                .join()).hasSize(5);
    }

    // =========================================================================
    // LIMIT
    // =========================================================================

    @Test
    @DisplayName("Should compare limits by value")
    void shouldCompareLimits() {
        assertThat(Limit.pages(3)).isEqualTo(Limit.pages(3)).isNotEqualTo(Limit.none());
        assertThat(Limit.pages(3).isReachedBy(3)).isTrue();
        assertThat(Limit.none().isReachedBy(Long.MAX_VALUE)).isFalse();
        assertThat(Limit.none().maxPages()).isEmpty();
    }
}
