package com.fhestream.domain.message;

import java.time.Instant;

/**
 * Message on the publish bus. eventId is unique and sorts roughly by publication order.
 */
public sealed interface PubSubMessage permits GlobalMessage, UserMessage {

    String eventId();

    String eventType();

    Instant publishedAt();

    /** Slot of the originating transaction, null for status messages. */
    Long slot();

    /** Signature of the originating transaction, null for status messages. */
    String signature();

    Object payload();

    /** Channel this message belongs on. */
    BusChannel channel();
}
