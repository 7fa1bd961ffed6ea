package com.example.pageturner.reactor;

import com.example.pageturner.Limit;
import com.example.pageturner.PageFetchException;
import com.example.pageturner.PageTurner;
import com.example.pageturner.PageTurners;
import com.example.pageturner.TurnedPage;
import com.example.pageturner.async.iterator.AsyncIterator;
import com.example.pageturner.support.BlogClient;
import com.example.pageturner.support.BlogClient.BlogRecord;
import com.example.pageturner.support.BlogClient.GetContentRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the Project Reactor bridges.
 *
 * <h2>Comparison with AsyncIterator</h2>
 * <table>
 *   <tr><th>Aspect</th><th>AsyncIterator</th><th>Flux</th></tr>
 *   <tr><td>Pull</td><td>nextAsync()</td><td>request(n)</td></tr>
 *   <tr><td>Early exit</td><td>cancel()</td><td>take()</td></tr>
 * </table>
 */
class ReactorPagesTest {

    // =========================================================================
    // FLUX OVER PAGE STREAMS
    // =========================================================================

    @Test
    @DisplayName("Should emit every record of a look-ahead stream")
    void shouldEmitAllRecords() {
        BlogClient blog = new BlogClient(33);

        List<BlogRecord> records = ReactorPages.flux(
                        () -> PageTurners.pagesAhead(blog, 5, Limit.none(), new GetContentRequest(0)).items())
                .collectList()
                .block(Duration.ofSeconds(10));

        assertThat(records).hasSize(33);
        assertThat(records.get(0)).isEqualTo(new BlogRecord(0));
        assertThat(records.get(32)).isEqualTo(new BlogRecord(32));
    }

    @Test
    @DisplayName("Should cancel the page stream when the subscriber takes fewer records")
    void shouldCancelOnTake() {
        BlogClient blog = new BlogClient(1000);
        AtomicReference<AsyncIterator<BlogRecord>> iterator = new AtomicReference<>();

        Flux<BlogRecord> records = ReactorPages.flux(() -> {
            iterator.set(PageTurners.pagesAhead(blog, 4, Limit.none(), new GetContentRequest(0)).items());
            return iterator.get();
        });

        List<BlogRecord> firstFive = records.take(5).collectList().block(Duration.ofSeconds(10));

        assertThat(firstFive).extracting(BlogRecord::id).containsExactly(0, 1, 2, 3, 4);
        assertThat(iterator.get().isCancelled()).isTrue();
        assertThat(blog.requestCount()).isLessThan(20);
    }

    @Test
    @DisplayName("Should start a fresh page stream for every subscription")
    void shouldBeCold() {
        BlogClient blog = new BlogClient(4);
        Flux<BlogRecord> records = ReactorPages.flux(() -> blog.pages(new GetContentRequest(0)).items());

        assertThat(records.count().block()).isEqualTo(4);
        assertThat(records.count().block()).isEqualTo(4);
        assertThat(blog.requestCount()).isEqualTo(8);
    }

    @Test
    @DisplayName("Should signal the page error downstream")
    void shouldSignalError() {
        BlogClient blog = new BlogClient(10);
        blog.setError(2);

        Flux<BlogRecord> records = ReactorPages.flux(
                () -> PageTurners.pagesAheadUnordered(blog, 3, Limit.none(), new GetContentRequest(0)).items());

        assertThatThrownBy(() -> records.collectList().block(Duration.ofSeconds(10)))
                .isInstanceOf(PageFetchException.class)
                .hasRootCauseMessage("Custom error");
    }

    // =========================================================================
    // REACTIVE PAGE TURNER
    // =========================================================================

    @Test
    @DisplayName("Should adapt a reactive fetch function to a page turner")
    void shouldAdaptReactiveFetch() {
        PageTurner<Integer, String> turner = ReactorPages.pageTurner(page -> Mono.fromSupplier(() ->
                page < 3
                        ? TurnedPage.next(List.of("page-" + page), page + 1)
                        : TurnedPage.<Integer, String>last(List.of("page-" + page))));

        List<String> items = turner.pagesAheadUnordered(2, Limit.none(), 0, page -> page + 1)
                .items()
                .collectAsync()
                .join();

        assertThat(items).containsExactlyInAnyOrder("page-0", "page-1", "page-2", "page-3");
    }

    @Test
    @DisplayName("Should fail the fetch when the reactive fetch completes empty")
    void shouldFailOnEmptyMono() {
        PageTurner<Integer, String> turner = ReactorPages.pageTurner(page -> Mono.empty());

        assertThatThrownBy(() -> turner.pages(0).nextAsync().join())
                .hasCauseInstanceOf(PageFetchException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }
}
