package com.fhestream.history;

import java.time.Instant;

/**
 * Gap-replay request. With {@code targetOwner} null only global messages match.
 *
 * @param afterEventId   exclusive position; resolved to its publication time when the store knows it
 * @param sinceSlot      inclusive slot bound
 * @param publishedAfter exclusive time bound, used when there is no usable afterEventId
 */
public record GapQuery(String afterEventId, Long sinceSlot, String targetOwner, Instant publishedAfter, int limit) {

    public static final int DEFAULT_LIMIT = 100;

    public GapQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    /** Same filters, continuing after {@code lastEventId}; used to page through a long gap. */
    public GapQuery next(String lastEventId) {
        return new GapQuery(lastEventId, sinceSlot, targetOwner, publishedAfter, limit);
    }

    public static GapQuery after(String afterEventId, Long sinceSlot, String targetOwner, int limit) {
        return new GapQuery(afterEventId, sinceSlot, targetOwner, null, limit);
    }
}
