package com.fhestream.ingestion.rpc;

import java.util.List;

/**
 * The parts of a confirmed transaction the indexer reads. feePayer is the first account key, null if absent.
 */
public record FetchedTransaction(String signature, long slot, Long blockTime, List<String> logMessages, String feePayer) {
}
