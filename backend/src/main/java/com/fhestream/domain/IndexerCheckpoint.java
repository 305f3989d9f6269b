package com.fhestream.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Durable indexer progress, one document per program. lastSlot only moves forward.
 */
@Document(collection = "indexer_checkpoints")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class IndexerCheckpoint {

    /** Program id (base58). */
    @Id
    @EqualsAndHashCode.Include
    private String programId;
    private long lastSlot;
    private String lastSignature;
    private Instant updatedAt;
}
