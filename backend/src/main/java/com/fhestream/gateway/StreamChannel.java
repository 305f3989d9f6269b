package com.fhestream.gateway;

import java.util.Locale;

/**
 * Channel a subscriber asks for: everything global, or one principal's own messages.
 */
public enum StreamChannel {
    GLOBAL,
    USER;

    /** Absent means {@code user}. */
    public static StreamChannel parse(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "global" -> GLOBAL;
            case "user" -> USER;
            default -> throw new StreamRequestException("INVALID_CHANNEL", "channel must be 'global' or 'user'");
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
