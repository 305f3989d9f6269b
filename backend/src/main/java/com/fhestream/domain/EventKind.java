package com.fhestream.domain;

/**
 * Closed set of program events the indexer understands. {@link #eventName()} is the canonical PascalCase name.
 */
public enum EventKind {
    INPUT_HANDLE_REGISTERED("InputHandleRegistered"),
    UNARY_OP_REQUESTED("UnaryOpRequested"),
    BINARY_OP_REQUESTED("BinaryOpRequested"),
    TERNARY_OP_REQUESTED("TernaryOpRequested");

    private final String eventName;

    EventKind(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
