package com.fhestream.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Payload of indexer.status and indexer.error. status is running, stopped or error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexerStatusPayload(String status, long lastSlot, String lastSignature, String error) {
}
