package com.fhestream.ingestion.logs;

import java.util.Map;

/**
 * Decoded but unvalidated event: its on-chain name and field values keyed as found.
 */
public record RawEventRecord(String name, Map<String, Object> data) {
}
