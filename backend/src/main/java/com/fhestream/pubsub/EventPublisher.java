package com.fhestream.pubsub;

import com.fhestream.domain.CiphertextRecord;
import com.fhestream.domain.Handle;
import com.fhestream.domain.IndexedEvent;
import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.domain.OperationEvent;
import com.fhestream.domain.message.CiphertextPayload;
import com.fhestream.domain.message.EventIds;
import com.fhestream.domain.message.EventTypes;
import com.fhestream.domain.message.GlobalMessage;
import com.fhestream.domain.message.IndexerStatusPayload;
import com.fhestream.domain.message.OperationCompletedPayload;
import com.fhestream.domain.message.OperationFailedPayload;
import com.fhestream.domain.message.PubSubMessage;
import com.fhestream.domain.message.UserMessage;
import com.fhestream.history.EventHistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Turns indexer output into bus messages. Every message is appended to the event history before it is published;
 * failures of either sink are logged and that sink skips the message, the caller is never failed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventPublisher {

    private final PublishBus bus;
    private final EventHistoryStore history;
    private final Clock clock;

    /**
     * One global message for the event plus one user message for its caller:
     * ciphertext.confirmed for a registered input handle, operation.completed for an operation.
     */
    public List<PubSubMessage> publishIndexedEvent(IndexedEvent event) {
        Instant now = clock.instant();
        GlobalMessage global = new GlobalMessage(
                EventIds.forTransaction(event.slot(), event.signature(), now.toEpochMilli()),
                EventTypes.indexed(event.kind()), now, event.slot(), event.signature(), event);
        UserMessage user;
        if (event instanceof InputHandleRegistered registered) {
            user = userMessage(registered, now, EventTypes.CIPHERTEXT_CONFIRMED,
                    new CiphertextPayload(registered.handle().hex(), registered.caller(), registered.clientTag(),
                            registered.signature(), registered.slot(), registered.blockTime()));
        } else {
            OperationEvent op = (OperationEvent) event;
            user = userMessage(op, now, EventTypes.OPERATION_COMPLETED,
                    new OperationCompletedPayload(op.op().name(), op.operationType().wireName(),
                            op.inputHandles().stream().map(Handle::hex).toList(), op.resultHandle().hex(),
                            op.caller(), op.signature(), op.slot(), op.blockTime()));
        }
        emit(global);
        emit(user);
        return List.of(global, user);
    }

    /** Tells the caller their operation was indexed but could not be recorded. */
    public PubSubMessage publishOperationFailed(OperationEvent event, String error) {
        UserMessage message = userMessage(event, clock.instant(), EventTypes.OPERATION_FAILED,
                new OperationFailedPayload(event.op().name(), event.operationType().wireName(), event.resultHandle().hex(),
                        event.caller(), event.signature(), event.slot(), error));
        emit(message);
        return message;
    }

    /** Announces an optimistic ciphertext registration to its owner, before any transaction exists. */
    public PubSubMessage publishCiphertextRegistered(CiphertextRecord record) {
        Instant now = clock.instant();
        UserMessage message = new UserMessage(EventIds.forStatus(now.toEpochMilli()), EventTypes.CIPHERTEXT_REGISTERED, now,
                record.getSlot(), record.getTxSignature(), record.getOwner(),
                new CiphertextPayload(record.getHandle(), record.getOwner(), record.getClientTag(),
                        record.getTxSignature(), record.getSlot(), null));
        emit(message);
        return message;
    }

    public PubSubMessage publishStatus(String status, long lastSlot, String lastSignature) {
        return publishGlobalStatus(EventTypes.INDEXER_STATUS, new IndexerStatusPayload(status, lastSlot, lastSignature, null));
    }

    public PubSubMessage publishError(long lastSlot, String lastSignature, String error) {
        return publishGlobalStatus(EventTypes.INDEXER_ERROR, new IndexerStatusPayload("error", lastSlot, lastSignature, error));
    }

    private PubSubMessage publishGlobalStatus(String eventType, IndexerStatusPayload payload) {
        Instant now = clock.instant();
        GlobalMessage message = new GlobalMessage(EventIds.forStatus(now.toEpochMilli()), eventType, now, null, null, payload);
        emit(message);
        return message;
    }

    private static UserMessage userMessage(IndexedEvent event, Instant now, String eventType, Object payload) {
        return new UserMessage(EventIds.forTransaction(event.slot(), event.signature(), now.toEpochMilli()),
                eventType, now, event.slot(), event.signature(), event.caller(), payload);
    }

    private void emit(PubSubMessage message) {
        try {
            history.append(message);
        } catch (RuntimeException e) {
            log.warn("Event history append failed for {} {}: {}", message.eventType(), message.eventId(), e.getMessage());
        }
        try {
            bus.publish(message.channel(), message);
        } catch (RuntimeException e) {
            log.warn("Dropped {} {} on {}: {}", message.eventType(), message.eventId(), message.channel().name(), e.getMessage());
        }
    }
}
