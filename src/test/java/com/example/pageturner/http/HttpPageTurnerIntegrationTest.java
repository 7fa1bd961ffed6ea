package com.example.pageturner.http;

import com.example.pageturner.Limit;
import com.example.pageturner.PageFetchException;
import com.example.pageturner.PageTurners;
import com.example.pageturner.streaming.AsyncIterators;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for HttpPageTurner against a local offset-paginated API.
 *
 * <h2>What This Tests</h2>
 * <p>The page streams driving real non-blocking HTTP requests: 1000 numbers served
 * in pages of 100. Offsets past the end are answered with 404, the way real APIs
 * answer speculative look-ahead requests.</p>
 */
class HttpPageTurnerIntegrationTest {

    private SimpleNumbersServer server;
    private HttpPageTurner<Integer> numbers;

    @BeforeEach
    void setUp() {
        server = SimpleNumbersServer.create(1000);
        server.start();
        numbers = new HttpPageTurner<>(server.getBaseUrl() + "/numbers", Integer.class);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    // =========================================================================
    // SEQUENTIAL
    // =========================================================================

    @Test
    @DisplayName("Should follow nextOffset of every response")
    void shouldFetchSequentially() throws Exception {
        // When
        List<Integer> all = numbers.pages(OffsetPageRequest.first(100))
                .items()
                .collectAsync()
                .get(30, TimeUnit.SECONDS);

        // Then: 10 pages, no request past the end
        assertThat(all).isEqualTo(server.getNumbers());
        assertThat(server.getRequestCount()).isEqualTo(10);
        assertThat(server.getNotFoundCount()).isZero();
    }

    // =========================================================================
    // LOOK-AHEAD
    // =========================================================================

    @Test
    @DisplayName("Should yield all numbers in order with 4 requests in flight")
    void shouldFetchAheadInOrder() throws Exception {
        List<Integer> all = PageTurners.pagesAhead(numbers, 4, Limit.none(), OffsetPageRequest.first(100))
                .items()
                .collectAsync()
                .get(30, TimeUnit.SECONDS);

        assertThat(all).isEqualTo(server.getNumbers());
        assertThat(server.getRequestCount()).isGreaterThanOrEqualTo(10);
    }

    @Test
    @DisplayName("Should issue exactly as many requests as the limit when the page count is known")
    void shouldNotOverFetchWithLimit() throws Exception {
        List<Integer> all = PageTurners.pagesAhead(numbers, 4, Limit.pages(10), OffsetPageRequest.first(100))
                .items()
                .collectAsync()
                .get(30, TimeUnit.SECONDS);

        assertThat(all).hasSize(1000);
        assertThat(server.getRequestCount()).isEqualTo(10);
        assertThat(server.getNotFoundCount()).isZero();
    }

    @Test
    @DisplayName("Should ignore 404 answers to requests past the last page when unordered")
    void shouldDiscardNotFoundPastTheEnd() throws Exception {
        List<Integer> all = PageTurners.pagesAheadUnordered(numbers, 4, Limit.none(), OffsetPageRequest.first(100))
                .items()
                .collectAsync()
                .get(30, TimeUnit.SECONDS);

        assertThat(all).containsExactlyInAnyOrderElementsOf(server.getNumbers());
    }

    @Test
    @DisplayName("Should stream numbers with the Java Stream API and stop early")
    void shouldStreamWithShortCircuit() {
        try (Stream<Integer> stream = AsyncIterators.stream(numbers.pages(OffsetPageRequest.first(100)).items())) {
            assertThat(stream.limit(150).mapToInt(Integer::intValue).sum()).isEqualTo(150 * 151 / 2);
        }

        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    // =========================================================================
    // ERRORS
    // =========================================================================

    @Test
    @DisplayName("Should fail the ordered stream with the status of the failed page")
    void shouldFailOnServerError() {
        // Given: the page at offset 300 fails with 500
        server.failAt(300);

        // When
        CompletableFuture<List<Integer>> all = PageTurners
                .pagesAhead(numbers, 4, Limit.none(), OffsetPageRequest.first(100))
                .items()
                .collectAsync();

        // Then
        assertThatThrownBy(() -> all.get(30, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(PageFetchException.class, e -> {
                    assertThat(e.getRequest()).isEqualTo(new OffsetPageRequest(300, 100));
                    assertThat(e.getRequestIndex()).hasValue(3);
                    assertThat(e.getCause())
                            .isInstanceOfSatisfying(HttpStatusException.class,
                                    status -> assertThat(status.getStatusCode()).isEqualTo(500));
                });
    }

    @Test
    @DisplayName("Should fail the unordered stream when a page within the data fails")
    void shouldFailUnorderedOnServerError() {
        server.failAt(300);

        CompletableFuture<List<Integer>> all = PageTurners
                .pagesAheadUnordered(numbers, 4, Limit.none(), OffsetPageRequest.first(100))
                .items()
                .collectAsync();

        assertThatThrownBy(() -> all.get(30, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(PageFetchException.class)
                .hasRootCauseInstanceOf(HttpStatusException.class);
    }

    @Test
    @DisplayName("Should answer a request past the end with a 404 status error")
    void shouldReportNotFound() {
        assertThatThrownBy(() -> numbers.turnPage(new OffsetPageRequest(5000, 100)).get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(HttpStatusException.class,
                        e -> assertThat(e.isNotFound()).isTrue());
    }
}
