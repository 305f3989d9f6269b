package com.fhestream.ingestion.handler;

import com.fhestream.domain.BinaryOpRequested;
import com.fhestream.domain.IndexedEvent;
import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.domain.TernaryOpRequested;
import com.fhestream.domain.UnaryOpRequested;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Routes each event to every registered handler in order. A handler failure is logged and the remaining
 * handlers still run.
 */
@Slf4j
public class EventDispatcher {

    private final List<IndexedEventHandler> handlers;

    public EventDispatcher(List<IndexedEventHandler> handlers) {
        this.handlers = List.copyOf(handlers);
    }

    /** @return number of handlers that threw */
    public int dispatch(IndexedEvent event) {
        log.info("{} in slot {} by {} ({})", event.kind().eventName(), event.slot(), event.caller(), event.signature());
        int failures = 0;
        for (IndexedEventHandler handler : handlers) {
            try {
                route(handler, event);
            } catch (RuntimeException e) {
                failures++;
                log.error("Handler {} failed on {} {}", handler.getClass().getSimpleName(), event.kind().eventName(), event.signature(), e);
            }
        }
        return failures;
    }

    private static void route(IndexedEventHandler handler, IndexedEvent event) {
        switch (event.kind()) {
            case INPUT_HANDLE_REGISTERED -> handler.onInputHandleRegistered((InputHandleRegistered) event);
            case UNARY_OP_REQUESTED -> handler.onUnaryOpRequested((UnaryOpRequested) event);
            case BINARY_OP_REQUESTED -> handler.onBinaryOpRequested((BinaryOpRequested) event);
            case TERNARY_OP_REQUESTED -> handler.onTernaryOpRequested((TernaryOpRequested) event);
        }
    }
}
