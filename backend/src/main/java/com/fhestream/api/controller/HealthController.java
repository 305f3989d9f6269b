package com.fhestream.api.controller;

import com.fhestream.api.dto.HealthResponse;
import com.fhestream.ingestion.indexer.IndexerStats;
import com.fhestream.ingestion.indexer.ProgramIndexer;
import com.fhestream.pubsub.PublishBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Locale;

/**
 * GET /api/v1/health: 200 while healthy or degraded, 503 when a check itself fails.
 */
@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    static final String HEALTHY = "healthy";
    static final String DEGRADED = "degraded";
    static final String UNHEALTHY = "unhealthy";

    private final ProgramIndexer programIndexer;
    private final PublishBus publishBus;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        String status = HEALTHY;

        HealthResponse.IndexerHealth indexer;
        try {
            IndexerStats stats = programIndexer.stats();
            indexer = new HealthResponse.IndexerHealth(
                    stats.running(),
                    stats.mode() != null ? stats.mode().name().toLowerCase(Locale.ROOT) : null,
                    stats.tier() != null ? stats.tier().name().toLowerCase(Locale.ROOT) : null,
                    stats.endpoint(),
                    stats.lastProcessedSlot(),
                    stats.lastProcessedSignature(),
                    stats.reconnectAttempts(),
                    stats.running() ? null : "Indexer is not running");
            if (!stats.running()) {
                status = DEGRADED;
            }
        } catch (RuntimeException e) {
            log.error("Failed to read indexer status", e);
            indexer = new HealthResponse.IndexerHealth(false, null, null, null, null, null, null, e.getMessage());
            status = UNHEALTHY;
        }

        HealthResponse.BusHealth bus;
        try {
            boolean connected = publishBus.isConnected();
            bus = new HealthResponse.BusHealth(connected, connected ? null : "Publish bus is not connected");
            if (!connected && !UNHEALTHY.equals(status)) {
                status = DEGRADED;
            }
        } catch (RuntimeException e) {
            log.error("Failed to read publish bus status", e);
            bus = new HealthResponse.BusHealth(false, e.getMessage());
            status = UNHEALTHY;
        }

        HealthResponse body = new HealthResponse(status, indexer, bus, clock.millis());
        HttpStatus code = UNHEALTHY.equals(status) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(code).body(body);
    }
}
