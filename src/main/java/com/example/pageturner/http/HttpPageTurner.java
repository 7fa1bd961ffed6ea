package com.example.pageturner.http;

import com.example.pageturner.PageTurner;
import com.example.pageturner.TurnedPage;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * A {@link PageTurner} over an offset-paginated JSON HTTP API.
 * Uses {@link HttpClient#sendAsync} for non-blocking I/O, so look-ahead streams
 * really have several requests in flight.
 *
 * <p>Each page is requested as {@code GET baseUrl?offset=<offset>&limit=<limit>} and
 * parsed as a {@link PageResponse}. A status of 400 or above fails the fetch with
 * {@link HttpStatusException}. Failed requests are not retried.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpPageTurner<Order> orders = new HttpPageTurner<>(
 *     "https://api.example.com/orders",
 *     Order.class
 * );
 *
 * // Sequential: follows "nextOffset" of every response
 * orders.pages(OffsetPageRequest.first(100)).items().forEachAsync(this::process);
 *
 * // Four requests in flight, pages in order, capped at the known page count
 * PageTurners.pagesAhead(orders, 4, Limit.pages(10), OffsetPageRequest.first(100))
 *     .items()
 *     .forEachAsync(this::process);
 * }</pre>
 *
 * @param <T> the type of items in each page
 */
public class HttpPageTurner<T> implements PageTurner<OffsetPageRequest, T> {

    private static final Logger log = LoggerFactory.getLogger(HttpPageTurner.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final JavaType pageType;
    private final Config config;

    /**
     * Creates a new HttpPageTurner with default configuration.
     *
     * @param baseUrl the URL of the API endpoint
     * @param itemClass the class of items in each page
     */
    public HttpPageTurner(String baseUrl, Class<T> itemClass) {
        this(baseUrl, itemClass, Config.defaults());
    }

    /**
     * Creates a new HttpPageTurner with custom configuration.
     */
    public HttpPageTurner(String baseUrl, Class<T> itemClass, Config config) {
        this(
                HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build(),
                new ObjectMapper(),
                baseUrl,
                itemClass,
                config
        );
    }

    /**
     * Creates a HttpPageTurner with a pre-configured HttpClient and ObjectMapper.
     */
    public HttpPageTurner(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            String baseUrl,
            Class<T> itemClass,
            Config config
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.pageType = objectMapper.getTypeFactory()
                .constructParametricType(PageResponse.class, itemClass);
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public CompletableFuture<TurnedPage<OffsetPageRequest, T>> turnPage(OffsetPageRequest request) {
        URI uri = buildUri(request);
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/json")
                .timeout(config.requestTimeout())
                .GET()
                .build();

        log.trace("GET {}", uri);
        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> toTurnedPage(request, response));
    }

    private URI buildUri(OffsetPageRequest request) {
        String separator = baseUrl.contains("?") ? "&" : "?";
        return URI.create(baseUrl + separator
                + config.offsetParamName() + "=" + request.offset()
                + "&" + config.limitParamName() + "=" + request.limit());
    }

    private TurnedPage<OffsetPageRequest, T> toTurnedPage(
            OffsetPageRequest request,
            HttpResponse<String> response
    ) {
        int statusCode = response.statusCode();
        if (statusCode >= 400) {
            throw new HttpStatusException(statusCode,
                    "HTTP error " + statusCode + " for offset " + request.offset());
        }

        PageResponse<T> page;
        try {
            page = objectMapper.readValue(response.body(), pageType);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse page at offset " + request.offset(), e);
        }

        if (!page.hasNextPage()) {
            return TurnedPage.last(page.data());
        }
        return TurnedPage.next(page.data(), new OffsetPageRequest(page.nextOffset(), request.limit()));
    }

    /**
     * Configuration of the HTTP page turner.
     *
     * @param connectTimeout connect timeout of the default HttpClient
     * @param requestTimeout timeout of every page request
     * @param offsetParamName query parameter carrying the offset
     * @param limitParamName query parameter carrying the page size
     */
    public record Config(
            Duration connectTimeout,
            Duration requestTimeout,
            String offsetParamName,
            String limitParamName
    ) {
        public Config {
            Objects.requireNonNull(connectTimeout, "connectTimeout");
            Objects.requireNonNull(requestTimeout, "requestTimeout");
            Objects.requireNonNull(offsetParamName, "offsetParamName");
            Objects.requireNonNull(limitParamName, "limitParamName");
        }

        public static Config defaults() {
            return new Config(Duration.ofSeconds(10), Duration.ofSeconds(30), "offset", "limit");
        }
    }
}
