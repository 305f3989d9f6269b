package com.fhestream.ingestion.indexer;

import com.fhestream.ingestion.config.IndexerMode;
import com.fhestream.ingestion.rpc.RpcTier;

public record IndexerStats(String programId, String endpoint, RpcTier tier, long pollIntervalMs, long lastProcessedSlot,
                           String lastProcessedSignature, IndexerMode mode, boolean running, int reconnectAttempts) {
}
