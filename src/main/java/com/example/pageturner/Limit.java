package com.example.pageturner;

import java.util.OptionalInt;

/**
 * Caps how many requests a look-ahead scheduler will ever issue, regardless of
 * what the responses say.
 *
 * <p>If the number of pages is known in advance, {@code Limit.pages(n)} prevents
 * speculative requests past the last existing page from being executed.
 */
public final class Limit {

    private static final Limit NONE = new Limit(-1);

    private final int maxPages;

    private Limit(int maxPages) {
        this.maxPages = maxPages;
    }

    /**
     * No cap: requests are derived until a response declares the last page.
     */
    public static Limit none() {
        return NONE;
    }

    /**
     * At most {@code maxPages} requests are produced.
     *
     * @throws IllegalArgumentException if {@code maxPages} is negative
     */
    public static Limit pages(int maxPages) {
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages must be >= 0, got " + maxPages);
        }
        return new Limit(maxPages);
    }

    public boolean isUnbounded() {
        return maxPages < 0;
    }

    public OptionalInt maxPages() {
        return isUnbounded() ? OptionalInt.empty() : OptionalInt.of(maxPages);
    }

    /**
     * Returns {@code true} if {@code produced} requests already reach this limit.
     */
    public boolean isReachedBy(long produced) {
        return !isUnbounded() && produced >= maxPages;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Limit other && other.maxPages == maxPages;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(maxPages);
    }

    @Override
    public String toString() {
        return isUnbounded() ? "Limit.none" : "Limit.pages(" + maxPages + ")";
    }
}
