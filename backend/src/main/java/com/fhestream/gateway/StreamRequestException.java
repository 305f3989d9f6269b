package com.fhestream.gateway;

import lombok.Getter;

/**
 * Connection parameters were rejected before the stream was opened.
 */
@Getter
public class StreamRequestException extends RuntimeException {

    private final String code;

    public StreamRequestException(String code, String message) {
        super(message);
        this.code = code;
    }
}
