package com.fhestream.domain;

import com.fhestream.common.Base58;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Deterministic result handle the program assigns to an operation:
 * sha256(domainTag || programId || opCode || inputs...). Clients use the same rule to predict handles
 * before confirmation, so the indexer can check that a result handle matches its inputs.
 */
public final class HandleDerivation {

    private static final byte[] DOMAIN_UNARY = "FHE16_UNARY_V1".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] DOMAIN_BINARY = "FHE16_BINARY_V1".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] DOMAIN_TERNARY = "FHE16_TERNARY_V1".getBytes(StandardCharsets.US_ASCII);

    private HandleDerivation() {
    }

    public static Handle derive(FheOperator op, List<Handle> inputs, String programId) {
        int expectedInputs = switch (op.type()) {
            case UNARY -> 1;
            case BINARY -> 2;
            case TERNARY -> 3;
        };
        if (inputs.size() != expectedInputs) {
            throw new IllegalArgumentException(op.type().wireName() + " op needs " + expectedInputs + " inputs, got " + inputs.size());
        }
        MessageDigest sha256 = sha256();
        sha256.update(domainTag(op.type()));
        sha256.update(Base58.decode(programId));
        sha256.update((byte) op.code());
        for (Handle input : inputs) {
            sha256.update(input.bytes());
        }
        return Handle.of(sha256.digest());
    }

    /** True when the event's result handle is the one the program would derive from its inputs. */
    public static boolean matches(OperationEvent event, String programId) {
        return derive(event.op(), event.inputHandles(), programId).equals(event.resultHandle());
    }

    private static byte[] domainTag(OperationType type) {
        return switch (type) {
            case UNARY -> DOMAIN_UNARY;
            case BINARY -> DOMAIN_BINARY;
            case TERNARY -> DOMAIN_TERNARY;
        };
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
