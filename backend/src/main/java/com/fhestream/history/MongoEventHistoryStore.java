package com.fhestream.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhestream.domain.EventStreamRecord;
import com.fhestream.domain.EventStreamRecordRepository;
import com.fhestream.domain.message.PubSubMessage;
import com.fhestream.domain.message.UserMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Event history on the event_stream collection. A known afterEventId resolves to its (publishedAt, eventId)
 * position so replay follows publication order; an unknown one falls back to lexical eventId comparison.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoEventHistoryStore implements EventHistoryStore {

    private final EventStreamRecordRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public void append(PubSubMessage message) {
        if (repository.existsById(message.eventId())) {
            log.debug("Event {} already stored", message.eventId());
            return;
        }
        EventStreamRecord record = new EventStreamRecord();
        record.setEventId(message.eventId());
        record.setChannel(message.channel().name());
        record.setEventType(message.eventType());
        record.setTargetOwner(message instanceof UserMessage user ? user.targetOwner() : null);
        record.setSlot(message.slot());
        record.setSignature(message.signature());
        record.setMessage(toJson(message));
        record.setPublishedAt(message.publishedAt());
        repository.save(record);
    }

    @Override
    public List<HistoricalEvent> queryGapEvents(GapQuery query) {
        Instant afterPublishedAt = null;
        String afterEventId = query.afterEventId();
        if (afterEventId != null) {
            Optional<EventStreamRecord> anchor = repository.findById(afterEventId);
            if (anchor.isPresent()) {
                afterPublishedAt = anchor.get().getPublishedAt();
            } else if (query.publishedAfter() != null) {
                afterPublishedAt = query.publishedAfter();
                afterEventId = null;
            } else {
                log.debug("Unknown lastEventId {}, comparing ids lexically", afterEventId);
            }
        } else {
            afterPublishedAt = query.publishedAfter();
        }
        return repository.findAfter(afterPublishedAt, afterEventId, query.sinceSlot(), query.targetOwner(), query.limit())
                .stream()
                .map(r -> new HistoricalEvent(r.getEventId(), r.getEventType(), r.getTargetOwner(), r.getSlot(), r.getMessage()))
                .toList();
    }

    private String toJson(PubSubMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize message " + message.eventId(), e);
        }
    }
}
