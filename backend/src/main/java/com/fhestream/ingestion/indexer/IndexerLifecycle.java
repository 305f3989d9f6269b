package com.fhestream.ingestion.indexer;

import com.fhestream.ingestion.config.IndexerProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Owns the indexer's lifetime: started once the application is ready, stopped before the context closes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexerLifecycle {

    private final ProgramIndexer indexer;
    private final IndexerProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled()) {
            log.info("Indexer disabled (fhestream.indexer.enabled=false)");
            return;
        }
        indexer.start();
    }

    @PreDestroy
    public void shutdown() {
        indexer.stop();
    }
}
