package com.fhestream.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Reads of indexer_checkpoints. Writes go through the conditional upsert in MongoCheckpointStore.
 */
public interface IndexerCheckpointRepository extends MongoRepository<IndexerCheckpoint, String> {
}
