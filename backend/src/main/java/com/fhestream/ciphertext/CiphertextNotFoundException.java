package com.fhestream.ciphertext;

public class CiphertextNotFoundException extends RuntimeException {

    public CiphertextNotFoundException(String handle) {
        super("Ciphertext not found: " + handle);
    }
}
