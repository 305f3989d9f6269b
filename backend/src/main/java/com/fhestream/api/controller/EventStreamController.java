package com.fhestream.api.controller;

import com.fhestream.gateway.StreamFrame;
import com.fhestream.gateway.StreamRequest;
import com.fhestream.gateway.StreamingGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * GET /events/stream: server-sent events for the global channel or one principal's channel.
 * Parameters are validated before the stream opens so bad requests get a 400 instead of an empty stream.
 */
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class EventStreamController {

    static final String LAST_EVENT_ID = "Last-Event-ID";

    private final StreamingGateway streamingGateway;

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(
            @RequestParam(required = false) String channel,
            @RequestParam(required = false) String principal,
            @RequestParam(required = false) String lastEventId,
            @RequestParam(required = false) String sinceSlot,
            @RequestHeader(name = LAST_EVENT_ID, required = false) String lastEventIdHeader,
            ServerHttpResponse response
    ) {
        StreamRequest request = StreamRequest.of(channel, principal, lastEventId, lastEventIdHeader, sinceSlot);
        HttpHeaders headers = response.getHeaders();
        headers.setCacheControl("no-cache, no-transform");
        headers.set("X-Accel-Buffering", "no");
        return streamingGateway.open(request).map(EventStreamController::toSse);
    }

    static ServerSentEvent<String> toSse(StreamFrame frame) {
        return switch (frame.kind()) {
            case CONNECTED -> ServerSentEvent.builder(frame.data()).event("connected").build();
            case EVENT -> ServerSentEvent.builder(frame.data()).id(frame.eventId()).build();
            case KEEP_ALIVE -> ServerSentEvent.<String>builder().comment(frame.data()).build();
            case ERROR -> ServerSentEvent.builder(frame.data()).event("error").build();
        };
    }
}
