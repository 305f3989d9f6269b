package com.fhestream.checkpoint;

import com.fhestream.domain.IndexerCheckpoint;
import com.fhestream.domain.IndexerCheckpointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Checkpoint store on indexer_checkpoints. The upsert only matches when the stored slot is not ahead of the new one,
 * so a regressing write either updates nothing or collides on the id and is dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoCheckpointStore implements CheckpointStore {

    static final int READ_ATTEMPTS = 3;
    private static final long READ_RETRY_DELAY_MS = 100;

    private final IndexerCheckpointRepository repository;
    private final MongoTemplate mongoTemplate;

    @Override
    public long getLastSlot(String programId) {
        return read(programId).map(IndexerCheckpoint::getLastSlot).orElse(0L);
    }

    @Override
    public Optional<String> getLastSignature(String programId) {
        return read(programId).map(IndexerCheckpoint::getLastSignature);
    }

    /**
     * Reads the checkpoint, retrying transient failures. Falls back to "no checkpoint" after
     * {@link #READ_ATTEMPTS} failures, in which case the indexer starts from the chain head.
     */
    private Optional<IndexerCheckpoint> read(String programId) {
        for (int attempt = 1; ; attempt++) {
            try {
                return repository.findById(programId);
            } catch (DataAccessException e) {
                if (attempt >= READ_ATTEMPTS) {
                    log.error("Checkpoint for program {} unreadable after {} attempts; indexing starts from the chain head "
                            + "and transactions after the stored checkpoint will not be indexed", programId, attempt, e);
                    return Optional.empty();
                }
                log.warn("Failed to read checkpoint for program {} (attempt {}/{}): {}", programId, attempt, READ_ATTEMPTS, e.getMessage());
                if (!pause(attempt)) {
                    log.error("Interrupted while reading checkpoint for program {}; indexing starts from the chain head", programId);
                    return Optional.empty();
                }
            }
        }
    }

    private static boolean pause(int attempt) {
        try {
            Thread.sleep(READ_RETRY_DELAY_MS * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void upsertCheckpoint(String programId, long slot, String signature) {
        Query query = new Query(where("_id").is(programId).and("lastSlot").lte(slot));
        Update update = new Update()
                .set("lastSlot", slot)
                .set("lastSignature", signature)
                .set("updatedAt", Instant.now());
        try {
            mongoTemplate.upsert(query, update, IndexerCheckpoint.class);
        } catch (DuplicateKeyException e) {
            log.warn("Ignored checkpoint regression for program {} to slot {}", programId, slot);
        } catch (DataAccessException e) {
            throw new CheckpointWriteException("Failed to write checkpoint for " + programId + " at slot " + slot, e);
        }
    }
}
