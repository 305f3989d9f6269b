package com.fhestream.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HexFormat;
import java.util.Locale;

/**
 * Opaque 32-byte ciphertext handle, kept as lowercase hex so it compares and serializes by value.
 * A handle of any other length cannot be constructed.
 */
public record Handle(@JsonValue String hex) {

    public static final int LENGTH = 32;

    public Handle {
        if (hex == null) {
            throw new IllegalArgumentException("handle is required");
        }
        String stripped = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (stripped.length() != LENGTH * 2 || !stripped.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new IllegalArgumentException("handle must be " + LENGTH + " bytes of hex, got '" + hex + "'");
        }
        hex = stripped.toLowerCase(Locale.ROOT);
    }

    public static Handle of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("handle must be " + LENGTH + " bytes, got " + (bytes == null ? "null" : bytes.length));
        }
        return new Handle(HexFormat.of().formatHex(bytes));
    }

    public byte[] bytes() {
        return HexFormat.of().parseHex(hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
