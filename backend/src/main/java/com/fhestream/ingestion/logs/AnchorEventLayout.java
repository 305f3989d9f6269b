package com.fhestream.ingestion.logs;

import com.fhestream.domain.BinaryOperator;
import com.fhestream.domain.FheOperator;
import com.fhestream.domain.TernaryOperator;
import com.fhestream.domain.UnaryOperator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;

/**
 * Borsh layout of each program event after its 8-byte discriminator, sha256("event:" + name)[0..8].
 */
enum AnchorEventLayout {

    INPUT_HANDLE_REGISTERED("InputHandleRegistered", null, List.of("handle", "client_tag")),
    UNARY_OP_REQUESTED("Fhe16UnaryOpRequested", UnaryOperator.class, List.of("input_handle", "result_handle")),
    BINARY_OP_REQUESTED("Fhe16BinaryOpRequested", BinaryOperator.class, List.of("lhs_handle", "rhs_handle", "result_handle")),
    TERNARY_OP_REQUESTED("Fhe16TernaryOpRequested", TernaryOperator.class, List.of("a_handle", "b_handle", "c_handle", "result_handle"));

    static final int DISCRIMINATOR_LENGTH = 8;

    private final String eventName;
    private final Class<? extends FheOperator> operatorType;
    /** 32-byte fields following caller (and op, when present). */
    private final List<String> byteFields;
    private final byte[] discriminator;

    AnchorEventLayout(String eventName, Class<? extends FheOperator> operatorType, List<String> byteFields) {
        this.eventName = eventName;
        this.operatorType = operatorType;
        this.byteFields = byteFields;
        this.discriminator = discriminatorOf(eventName);
    }

    String eventName() {
        return eventName;
    }

    Class<? extends FheOperator> operatorType() {
        return operatorType;
    }

    List<String> byteFields() {
        return byteFields;
    }

    static AnchorEventLayout forDiscriminator(byte[] data) {
        if (data.length < DISCRIMINATOR_LENGTH) {
            return null;
        }
        byte[] head = Arrays.copyOf(data, DISCRIMINATOR_LENGTH);
        for (AnchorEventLayout layout : values()) {
            if (Arrays.equals(layout.discriminator, head)) {
                return layout;
            }
        }
        return null;
    }

    static byte[] discriminatorOf(String eventName) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(("event:" + eventName).getBytes(StandardCharsets.UTF_8));
            return Arrays.copyOf(hash, DISCRIMINATOR_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
