package com.fhestream.history;

import com.fhestream.domain.message.PubSubMessage;

import java.util.List;

/**
 * Append-only log of published messages used for gap replay.
 */
public interface EventHistoryStore {

    /** Stores the message. Appending an eventId that is already stored is a no-op. */
    void append(PubSubMessage message);

    /** Messages after the query position, oldest first, at most {@code query.limit()}. */
    List<HistoricalEvent> queryGapEvents(GapQuery query);
}
