package com.fhestream.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One published message as kept for gap replay. The eventId is the document id, so re-appending is a no-op.
 * {@code message} holds the exact JSON that was sent to live subscribers.
 */
@Document(collection = "event_stream")
@CompoundIndexes({
        @CompoundIndex(name = "published_event", def = "{'publishedAt': 1, '_id': 1}"),
        @CompoundIndex(name = "owner_published", def = "{'targetOwner': 1, 'publishedAt': 1}"),
        @CompoundIndex(name = "slot_published", def = "{'slot': 1, 'publishedAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EventStreamRecord {

    @Id
    @EqualsAndHashCode.Include
    private String eventId;
    private String channel;
    private String eventType;
    /** Null for global-channel messages. */
    private String targetOwner;
    /** Null for status messages that are not tied to a transaction. */
    private Long slot;
    private String signature;
    private String message;
    private Instant publishedAt;
}
