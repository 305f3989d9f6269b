package com.fhestream.ingestion.handler;

import com.fhestream.domain.BinaryOpRequested;
import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.domain.TernaryOpRequested;
import com.fhestream.domain.UnaryOpRequested;

/**
 * Consumer of typed program events, called in chain order. Delivery is at-least-once (a cycle that fails before
 * its checkpoint write is replayed), so implementations must be idempotent. Throwing is allowed: the failure is
 * logged and neither stops the indexer nor holds back the checkpoint.
 */
public interface IndexedEventHandler {

    default void onInputHandleRegistered(InputHandleRegistered event) {
    }

    default void onUnaryOpRequested(UnaryOpRequested event) {
    }

    default void onBinaryOpRequested(BinaryOpRequested event) {
    }

    default void onTernaryOpRequested(TernaryOpRequested event) {
    }
}
