package com.fhestream.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Overall status is healthy, degraded (indexer stopped or bus down) or unhealthy (a check failed).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(String status, IndexerHealth indexer, BusHealth bus, long timestamp) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record IndexerHealth(
            boolean running,
            String mode,
            String tier,
            String endpoint,
            Long lastSlot,
            String lastSignature,
            Integer reconnectAttempts,
            String error
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BusHealth(boolean connected, String error) {
    }
}
