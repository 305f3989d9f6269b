package com.fhestream.checkpoint;

/**
 * Thrown when the checkpoint could not be persisted. The indexer ends the cycle and retries from the old checkpoint.
 */
public class CheckpointWriteException extends RuntimeException {

    public CheckpointWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
