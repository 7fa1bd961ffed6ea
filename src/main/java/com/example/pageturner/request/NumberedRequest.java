package com.example.pageturner.request;

/**
 * A request tagged with its 0-based position in the request chain.
 *
 * @param index position of the request in the chain
 * @param request the request itself
 * @param <R> the request type
 */
public record NumberedRequest<R>(long index, R request) {
}
