package com.fhestream.domain.message;

import com.fhestream.domain.EventKind;

/**
 * Wire names of message types.
 */
public final class EventTypes {

    public static final String INDEXER_STATUS = "indexer.status";
    public static final String INDEXER_ERROR = "indexer.error";

    public static final String CIPHERTEXT_REGISTERED = "user.ciphertext.registered";
    public static final String CIPHERTEXT_CONFIRMED = "user.ciphertext.confirmed";
    public static final String OPERATION_COMPLETED = "user.operation.completed";
    public static final String OPERATION_FAILED = "user.operation.failed";

    private EventTypes() {
    }

    /** e.g. {@code indexer.BinaryOpRequested}. */
    public static String indexed(EventKind kind) {
        return "indexer." + kind.eventName();
    }
}
