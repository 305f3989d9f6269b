package com.fhestream.history;

/**
 * A stored message as replayed to a reconnecting subscriber. {@code json} is the serialized message.
 */
public record HistoricalEvent(String eventId, String eventType, String targetOwner, Long slot, String json) {
}
