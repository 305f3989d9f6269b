package com.fhestream.ingestion.normalizer;

/**
 * A raw event is missing a field or has a field of the wrong shape.
 */
public class MalformedEventException extends RuntimeException {

    public MalformedEventException(String message) {
        super(message);
    }
}
