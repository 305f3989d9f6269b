package com.fhestream.gateway;

import com.fhestream.domain.message.BusChannel;
import com.fhestream.domain.message.PubSubMessage;
import com.fhestream.domain.message.UserMessage;
import com.fhestream.pubsub.BusSubscription;
import com.fhestream.pubsub.BusUnavailableException;
import com.fhestream.pubsub.PublishBus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of one open stream: the live buffer fed by the bus, the most recent replayed ids, and the watermark.
 * Bus messages arrive on publisher threads and are buffered until the stream drains them after replay.
 * Only replayed ids are remembered, because only messages published while the replay ran can reach the stream
 * twice; each is forgotten once its live copy has been skipped.
 */
@Slf4j
class SubscriberSession {

    @Getter
    private final StreamRequest request;
    @Getter
    private final Instant connectedAt;
    private final Sinks.Many<PubSubMessage> liveBuffer = Sinks.many().unicast().onBackpressureBuffer();
    /** Replayed ids kept for live dedupe; the newest ones are enough since duplicates are the replay's tail. */
    static final int MAX_REPLAYED_IDS = 1024;

    private final Set<String> replayedIds = new LinkedHashSet<>();
    private final AtomicLong sent = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile BusSubscription subscription;
    private volatile String watermarkEventId;

    SubscriberSession(StreamRequest request, Instant connectedAt) {
        this.request = request;
        this.connectedAt = connectedAt;
        this.watermarkEventId = request.lastEventId();
    }

    BusChannel busChannel() {
        return request.channel() == StreamChannel.USER ? BusChannel.user(request.principal()) : BusChannel.global();
    }

    /** History filter owner: the principal on the user channel, none (global only) otherwise. */
    String targetOwner() {
        return request.channel() == StreamChannel.USER ? request.principal() : null;
    }

    /**
     * Subscribes to the bus into the live buffer.
     *
     * @return false when the bus is unavailable and the stream must poll history instead
     */
    boolean attach(PublishBus bus) {
        try {
            subscription = bus.subscribe(busChannel(), this::offer);
            return true;
        } catch (BusUnavailableException e) {
            log.warn("Bus unavailable for {}, falling back to history polling: {}", busChannel().name(), e.getMessage());
            return false;
        }
    }

    /** Live messages in arrival order, minus replayed ones and anything scoped to another principal. */
    Flux<PubSubMessage> live() {
        return liveBuffer.asFlux()
                .filter(this::isForThisSubscriber)
                .filter(message -> acceptLive(message.eventId()));
    }

    /** Records a replayed id. Returns false when this replay already sent it. */
    synchronized boolean markReplayed(String eventId) {
        if (!replayedIds.add(eventId)) {
            return false;
        }
        if (replayedIds.size() > MAX_REPLAYED_IDS) {
            Iterator<String> oldest = replayedIds.iterator();
            oldest.next();
            oldest.remove();
        }
        advanceWatermark(eventId);
        return true;
    }

    /** False for the live copy of a replayed message, which is then forgotten. */
    synchronized boolean acceptLive(String eventId) {
        if (replayedIds.remove(eventId)) {
            return false;
        }
        advanceWatermark(eventId);
        return true;
    }

    void advanceWatermark(String eventId) {
        watermarkEventId = eventId;
        sent.incrementAndGet();
    }

    synchronized int replayedIdCount() {
        return replayedIds.size();
    }

    String watermarkEventId() {
        return watermarkEventId;
    }

    boolean isClosed() {
        return closed.get();
    }

    void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        BusSubscription current = subscription;
        if (current != null) {
            current.cancel();
        }
        completeBuffer();
        log.debug("Stream session on {} closed after {} events", busChannel().name(), sent.get());
    }

    private synchronized void offer(PubSubMessage message) {
        if (closed.get()) {
            return;
        }
        Sinks.EmitResult result = liveBuffer.tryEmitNext(message);
        if (result.isFailure()) {
            log.warn("Dropped live event {} for {}: {}", message.eventId(), busChannel().name(), result);
        }
    }

    private synchronized void completeBuffer() {
        liveBuffer.tryEmitComplete();
    }

    private boolean isForThisSubscriber(PubSubMessage message) {
        if (request.channel() != StreamChannel.USER) {
            return !(message instanceof UserMessage);
        }
        return message instanceof UserMessage user && request.principal().equals(user.targetOwner());
    }
}
