package com.fhestream.api.controller;

import com.fhestream.ingestion.config.IndexerMode;
import com.fhestream.ingestion.indexer.IndexerStats;
import com.fhestream.ingestion.indexer.ProgramIndexer;
import com.fhestream.ingestion.rpc.RpcTier;
import com.fhestream.pubsub.PublishBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private ProgramIndexer indexer;
    private PublishBus bus;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        indexer = mock(ProgramIndexer.class);
        bus = mock(PublishBus.class);
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        webTestClient = WebTestClient.bindToController(new HealthController(indexer, bus, clock)).build();
    }

    @Test
    void runningIndexerAndConnectedBus_isHealthy() {
        when(indexer.stats()).thenReturn(stats(true));
        when(bus.isConnected()).thenReturn(true);

        webTestClient.get().uri("/api/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("healthy")
                .jsonPath("$.indexer.mode").isEqualTo("polling")
                .jsonPath("$.indexer.tier").isEqualTo("local")
                .jsonPath("$.indexer.lastSlot").isEqualTo(1234)
                .jsonPath("$.bus.connected").isEqualTo(true)
                .jsonPath("$.timestamp").isEqualTo(1740830400000L);
    }

    @Test
    void stoppedIndexerOrBusDown_isDegraded() {
        when(indexer.stats()).thenReturn(stats(false));
        when(bus.isConnected()).thenReturn(false);

        webTestClient.get().uri("/api/v1/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded")
                .jsonPath("$.indexer.error").isEqualTo("Indexer is not running")
                .jsonPath("$.bus.error").isEqualTo("Publish bus is not connected");
    }

    @Test
    void failingCheck_isUnhealthy503() {
        when(indexer.stats()).thenThrow(new IllegalStateException("indexer not initialised"));
        when(bus.isConnected()).thenReturn(true);

        webTestClient.get().uri("/api/v1/health")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status").isEqualTo("unhealthy")
                .jsonPath("$.indexer.error").isEqualTo("indexer not initialised");
    }

    private static IndexerStats stats(boolean running) {
        return new IndexerStats("program", "http://127.0.0.1:8899", RpcTier.LOCAL, 500, 1234, "sig", IndexerMode.POLLING,
                running, 0);
    }
}
