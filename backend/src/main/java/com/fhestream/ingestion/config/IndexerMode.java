package com.fhestream.ingestion.config;

/**
 * How the indexer learns about new transactions. PUSH falls back to POLLING when the subscription keeps failing.
 */
public enum IndexerMode {
    POLLING,
    PUSH
}
