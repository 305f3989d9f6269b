package com.fhestream.domain.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GlobalMessage(String eventId, String eventType, Instant publishedAt, Long slot, String signature,
                            Object payload) implements PubSubMessage {

    @Override
    @JsonIgnore
    public BusChannel channel() {
        return BusChannel.global();
    }
}
