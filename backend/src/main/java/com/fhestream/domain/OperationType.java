package com.fhestream.domain;

import java.util.Locale;

/**
 * Arity of a requested ciphertext operation.
 */
public enum OperationType {
    UNARY,
    BINARY,
    TERNARY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
