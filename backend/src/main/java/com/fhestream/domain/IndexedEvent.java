package com.fhestream.domain;

/**
 * Typed program event extracted from one transaction. Immutable; produced only by the normalizer.
 */
public sealed interface IndexedEvent permits InputHandleRegistered, OperationEvent {

    String signature();

    long slot();

    /** Epoch seconds; null when the chain did not report one. */
    Long blockTime();

    /** Base58 public key of the account that emitted the event. */
    String caller();

    EventKind kind();
}
