package com.fhestream.pubsub;

import com.fhestream.domain.message.BusChannel;
import com.fhestream.domain.message.PubSubMessage;

import java.util.function.Consumer;

/**
 * Fan-out of messages to channel subscribers. Delivery is at-least-once while subscribed, without retries.
 */
public interface PublishBus {

    /**
     * Delivers the message to every current subscriber of the channel.
     *
     * @throws BusUnavailableException when the bus is disconnected
     * @throws IllegalArgumentException when a user message is published to another principal's channel
     */
    void publish(BusChannel channel, PubSubMessage message);

    /**
     * @throws BusUnavailableException when the bus is disconnected
     */
    BusSubscription subscribe(BusChannel channel, Consumer<PubSubMessage> handler);

    boolean isConnected();

    int subscriberCount(BusChannel channel);
}
