package com.fhestream.pubsub;

/**
 * The publish bus cannot accept publishes or subscriptions right now.
 */
public class BusUnavailableException extends RuntimeException {

    public BusUnavailableException(String message) {
        super(message);
    }
}
