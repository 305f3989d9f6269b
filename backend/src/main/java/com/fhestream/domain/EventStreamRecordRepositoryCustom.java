package com.fhestream.domain;

import java.time.Instant;
import java.util.List;

/**
 * Custom gap-replay query using MongoTemplate.
 */
public interface EventStreamRecordRepositoryCustom {

    /**
     * Records strictly after the (publishedAt, eventId) position, from {@code minSlot} on, oldest first.
     *
     * @param afterPublishedAt exclusive lower bound, tie-broken by {@code afterEventId} when that is set; null for no bound
     * @param afterEventId     tiebreak for equal publishedAt, or a lexical bound when {@code afterPublishedAt} is null
     * @param minSlot          inclusive slot bound; null for no bound
     * @param targetOwner      only this principal's messages; null for global messages only
     * @param limit            max records returned
     */
    List<EventStreamRecord> findAfter(Instant afterPublishedAt, String afterEventId, Long minSlot, String targetOwner, int limit);
}
