package com.fhestream.domain.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Message scoped to one principal. targetOwner is the caller or owner of the event it derives from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserMessage(String eventId, String eventType, Instant publishedAt, Long slot, String signature,
                          String targetOwner, Object payload) implements PubSubMessage {

    public UserMessage {
        if (targetOwner == null || targetOwner.isBlank()) {
            throw new IllegalArgumentException("targetOwner is required");
        }
    }

    @Override
    @JsonIgnore
    public BusChannel channel() {
        return BusChannel.user(targetOwner);
    }
}
