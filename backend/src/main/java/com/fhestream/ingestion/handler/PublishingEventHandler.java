package com.fhestream.ingestion.handler;

import com.fhestream.domain.BinaryOpRequested;
import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.domain.TernaryOpRequested;
import com.fhestream.domain.UnaryOpRequested;
import com.fhestream.pubsub.EventPublisher;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Forwards every indexed event to the publish bus. Runs after the persisting handlers.
 */
@Component
@Order(100)
@RequiredArgsConstructor
public class PublishingEventHandler implements IndexedEventHandler {

    private final EventPublisher eventPublisher;

    @Override
    public void onInputHandleRegistered(InputHandleRegistered event) {
        eventPublisher.publishIndexedEvent(event);
    }

    @Override
    public void onUnaryOpRequested(UnaryOpRequested event) {
        eventPublisher.publishIndexedEvent(event);
    }

    @Override
    public void onBinaryOpRequested(BinaryOpRequested event) {
        eventPublisher.publishIndexedEvent(event);
    }

    @Override
    public void onTernaryOpRequested(TernaryOpRequested event) {
        eventPublisher.publishIndexedEvent(event);
    }
}
