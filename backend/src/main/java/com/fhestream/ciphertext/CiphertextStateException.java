package com.fhestream.ciphertext;

/**
 * Requested transition is not allowed from the ciphertext's current status.
 */
public class CiphertextStateException extends RuntimeException {

    public CiphertextStateException(String message) {
        super(message);
    }
}
