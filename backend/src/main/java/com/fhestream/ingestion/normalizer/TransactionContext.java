package com.fhestream.ingestion.normalizer;

/**
 * Transaction facts shared by all events decoded from it. feePayer may be null.
 */
public record TransactionContext(String signature, long slot, Long blockTime, String feePayer) {
}
