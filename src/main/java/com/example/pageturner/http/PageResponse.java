package com.example.pageturner.http;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON body of an offset-paginated API response.
 *
 * <p>Example:
 * <pre>
 * {
 *   "data": [...],
 *   "nextOffset": 200,
 *   "hasMore": true
 * }
 * </pre>
 *
 * @param <T> the type of items in the page
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageResponse<T>(
        List<T> data,
        Long nextOffset,
        boolean hasMore
) {
    @JsonCreator
    public PageResponse(
            @JsonProperty("data") List<T> data,
            @JsonProperty("nextOffset") Long nextOffset,
            @JsonProperty("hasMore") boolean hasMore
    ) {
        this.data = data != null ? List.copyOf(data) : List.of();
        this.nextOffset = nextOffset;
        this.hasMore = hasMore;
    }

    /**
     * Checks if there are more pages available.
     */
    public boolean hasNextPage() {
        return hasMore && nextOffset != null;
    }
}
