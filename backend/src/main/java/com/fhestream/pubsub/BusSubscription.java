package com.fhestream.pubsub;

/**
 * Handle to a live bus subscription. Cancelling twice is harmless.
 */
@FunctionalInterface
public interface BusSubscription {

    void cancel();
}
