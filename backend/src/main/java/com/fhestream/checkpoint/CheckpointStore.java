package com.fhestream.checkpoint;

import java.util.Optional;

/**
 * Durable per-program indexer progress.
 */
public interface CheckpointStore {

    /** Last fully processed slot, or 0 when nothing was recorded or the store could not be read. */
    long getLastSlot(String programId);

    Optional<String> getLastSignature(String programId);

    /**
     * Records (slot, signature) as processed. A slot lower than the stored one is ignored, never written.
     *
     * @throws CheckpointWriteException when the write fails
     */
    void upsertCheckpoint(String programId, long slot, String signature);
}
