package com.fhestream.ingestion.indexer;

/**
 * One logsSubscribe notification: a transaction touching the program. {@code failed} when it carries an error.
 */
public record LogsNotification(String signature, long slot, boolean failed) {
}
