package com.fhestream.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fhestream.domain.message.PubSubMessage;
import com.fhestream.history.EventHistoryStore;
import com.fhestream.history.GapQuery;
import com.fhestream.history.HistoricalEvent;
import com.fhestream.pubsub.PublishBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Opens subscriber streams: connected frame, gap fill from history, then live bus messages (or history polling
 * when the bus is down) interleaved with keep-alive comments. Cancelling the returned flux releases the bus
 * subscription and every timer of the connection.
 */
@Service
@Slf4j
public class StreamingGateway {

    private final PublishBus bus;
    private final EventHistoryStore history;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;
    private final Scheduler timerScheduler;
    private final Scheduler queryScheduler;

    @Autowired
    public StreamingGateway(PublishBus bus, EventHistoryStore history, ObjectMapper objectMapper,
                            GatewayProperties properties, Clock clock) {
        this(bus, history, objectMapper, properties, clock, Schedulers.parallel(), Schedulers.boundedElastic());
    }

    StreamingGateway(PublishBus bus, EventHistoryStore history, ObjectMapper objectMapper, GatewayProperties properties,
                     Clock clock, Scheduler timerScheduler, Scheduler queryScheduler) {
        this.bus = bus;
        this.history = history;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.timerScheduler = timerScheduler;
        this.queryScheduler = queryScheduler;
    }

    public Flux<StreamFrame> open(StreamRequest request) {
        return Flux.defer(() -> {
            SubscriberSession session = new SubscriberSession(request, clock.instant());
            boolean live = session.attach(bus);
            log.info("Stream opened: channel={}, principal={}, lastEventId={}, sinceSlot={}, live={}",
                    request.channel().wireName(), request.principal(), request.lastEventId(), request.sinceSlot(), live);

            Flux<StreamFrame> updates = live ? liveFrames(session) : fallbackFrames(session);
            Flux<StreamFrame> keepAlive = Flux.interval(properties.getKeepAliveInterval(), properties.getKeepAliveInterval(), timerScheduler)
                    .map(tick -> StreamFrame.keepAlive());

            return Flux.concat(
                            Mono.fromSupplier(() -> StreamFrame.connected(connectedJson(session))),
                            replay(session),
                            Flux.merge(updates, keepAlive))
                    .onErrorResume(e -> {
                        log.error("Stream on {} failed", session.busChannel().name(), e);
                        return Mono.just(StreamFrame.error(errorJson("Stream failed", e.getMessage())));
                    })
                    .doFinally(signal -> {
                        session.close();
                        log.info("Stream closed: channel={}, principal={}, signal={}",
                                request.channel().wireName(), request.principal(), signal);
                    });
        });
    }

    /**
     * Replays everything newer than the client's marker, one page at a time, until a page comes back short.
     */
    private Flux<StreamFrame> replay(SubscriberSession session) {
        StreamRequest request = session.getRequest();
        if (!request.wantsGapFill()) {
            return Flux.empty();
        }
        GapQuery first = GapQuery.after(request.lastEventId(), request.sinceSlot(), session.targetOwner(), properties.getGapFillLimit());
        return fetchPage(first)
                .expand(page -> page.isLast() ? Mono.empty() : fetchPage(page.query().next(page.lastEventId())))
                .doOnNext(page -> log.debug("Gap fill for {}: {} events", session.busChannel().name(), page.events().size()))
                .concatMapIterable(ReplayPage::events)
                .filter(event -> session.markReplayed(event.eventId()))
                .map(event -> StreamFrame.event(event.eventId(), event.json()))
                .onErrorResume(e -> {
                    log.warn("Gap fill failed for {}, continuing with live events", session.busChannel().name(), e);
                    return Flux.empty();
                });
    }

    private Mono<ReplayPage> fetchPage(GapQuery query) {
        return Mono.fromCallable(() -> new ReplayPage(query, history.queryGapEvents(query)))
                .subscribeOn(queryScheduler);
    }

    private Flux<StreamFrame> liveFrames(SubscriberSession session) {
        return session.live().concatMap(message -> toFrame(message, session));
    }

    private Flux<StreamFrame> fallbackFrames(SubscriberSession session) {
        return Flux.interval(properties.getFallbackPollInterval(), properties.getFallbackPollInterval(), timerScheduler)
                .onBackpressureDrop()
                .concatMap(tick -> pollHistory(session), 1);
    }

    private Flux<StreamFrame> pollHistory(SubscriberSession session) {
        if (session.isClosed()) {
            return Flux.empty();
        }
        GapQuery query = new GapQuery(session.watermarkEventId(), null, session.targetOwner(),
                session.getConnectedAt(), properties.getGapFillLimit());
        return Mono.fromCallable(() -> history.queryGapEvents(query))
                .subscribeOn(queryScheduler)
                .flatMapIterable(events -> events)
                .doOnNext(event -> session.advanceWatermark(event.eventId()))
                .map(event -> StreamFrame.event(event.eventId(), event.json()))
                .onErrorResume(e -> {
                    log.warn("Fallback poll failed for {}: {}", session.busChannel().name(), e.getMessage());
                    return Flux.empty();
                });
    }

    private Mono<StreamFrame> toFrame(PubSubMessage message, SubscriberSession session) {
        try {
            return Mono.just(StreamFrame.event(message.eventId(), objectMapper.writeValueAsString(message)));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize event {} for {}", message.eventId(), session.busChannel().name(), e);
            return Mono.empty();
        }
    }

    private String connectedJson(SubscriberSession session) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channel", session.getRequest().channel().wireName());
        body.put("principal", session.getRequest().principal());
        body.put("timestamp", session.getConnectedAt().toEpochMilli());
        return write(body);
    }

    private String errorJson(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message == null ? "Unknown error" : message);
        return write(body);
    }

    private String write(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize stream frame", e);
        }
    }

    private record ReplayPage(GapQuery query, List<HistoricalEvent> events) {

        /** A short page, or one that did not move past the cursor, ends the replay. */
        boolean isLast() {
            return events.size() < query.limit() || lastEventId().equals(query.afterEventId());
        }

        String lastEventId() {
            return events.get(events.size() - 1).eventId();
        }
    }
}
