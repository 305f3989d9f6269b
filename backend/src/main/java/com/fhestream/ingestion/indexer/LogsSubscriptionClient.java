package com.fhestream.ingestion.indexer;

import reactor.core.publisher.Flux;

/**
 * Push source of program transactions. The returned flux errors or completes when the connection is lost;
 * {@code onSubscribed} runs once the node has confirmed the subscription.
 */
public interface LogsSubscriptionClient {

    Flux<LogsNotification> subscribe(String programId, String commitment, Runnable onSubscribed);
}
