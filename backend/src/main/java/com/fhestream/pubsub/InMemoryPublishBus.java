package com.fhestream.pubsub;

import com.fhestream.domain.message.BusChannel;
import com.fhestream.domain.message.PubSubMessage;
import com.fhestream.domain.message.UserMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-process publish bus. Subscribers are called synchronously on the publishing thread; one failing subscriber
 * does not keep the message from the others. Subscriber lists are copy-on-write so subscribing and cancelling
 * are safe during delivery.
 */
@Component
@Slf4j
public class InMemoryPublishBus implements PublishBus {

    private final Map<String, List<Consumer<PubSubMessage>>> subscribers = new ConcurrentHashMap<>();
    private volatile boolean connected = true;

    @Override
    public void publish(BusChannel channel, PubSubMessage message) {
        ensureConnected();
        if (message instanceof UserMessage user && !channel.isUser()) {
            throw new IllegalArgumentException("User message " + user.eventId() + " published to " + channel.name());
        }
        if (channel.isUser() && !(message instanceof UserMessage scoped && channel.principal().equals(scoped.targetOwner()))) {
            throw new IllegalArgumentException("Message " + message.eventId() + " does not target " + channel.name());
        }
        List<Consumer<PubSubMessage>> handlers = subscribers.get(channel.name());
        if (handlers == null || handlers.isEmpty()) {
            log.debug("No subscribers on {} for {}", channel.name(), message.eventType());
            return;
        }
        int delivered = 0;
        for (Consumer<PubSubMessage> handler : handlers) {
            try {
                handler.accept(message);
                delivered++;
            } catch (RuntimeException e) {
                log.error("Subscriber on {} failed for event {}", channel.name(), message.eventId(), e);
            }
        }
        log.debug("Published {} {} on {} to {}/{} subscribers", message.eventType(), message.eventId(), channel.name(), delivered, handlers.size());
    }

    @Override
    public BusSubscription subscribe(BusChannel channel, Consumer<PubSubMessage> handler) {
        ensureConnected();
        List<Consumer<PubSubMessage>> handlers = subscribers.computeIfAbsent(channel.name(), k -> new CopyOnWriteArrayList<>());
        handlers.add(handler);
        log.debug("Subscribed to {}, {} subscribers", channel.name(), handlers.size());
        AtomicBoolean cancelled = new AtomicBoolean();
        return () -> {
            if (cancelled.compareAndSet(false, true)) {
                handlers.remove(handler);
                log.debug("Unsubscribed from {}, {} subscribers left", channel.name(), handlers.size());
            }
        };
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public int subscriberCount(BusChannel channel) {
        List<Consumer<PubSubMessage>> handlers = subscribers.get(channel.name());
        return handlers == null ? 0 : handlers.size();
    }

    /** Simulates losing or regaining the bus; while disconnected publish and subscribe throw. */
    public void setConnected(boolean connected) {
        this.connected = connected;
        log.info("Publish bus {}", connected ? "connected" : "disconnected");
    }

    private void ensureConnected() {
        if (!connected) {
            throw new BusUnavailableException("Publish bus is not connected");
        }
    }
}
