package com.fhestream.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Operator carried by an operation event. {@link #code()} is the on-chain enum index.
 */
public interface FheOperator {

    String name();

    int code();

    OperationType type();

    /**
     * Case- and separator-insensitive lookup: "SDiv", "s_div" and "SDIV" all resolve to the same constant.
     */
    static <E extends Enum<E> & FheOperator> Optional<E> lookup(Class<E> type, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = squash(raw);
        return Arrays.stream(type.getEnumConstants())
                .filter(e -> squash(e.name()).equals(key))
                .findFirst();
    }

    static <E extends Enum<E> & FheOperator> Optional<E> byCode(Class<E> type, int code) {
        E[] values = type.getEnumConstants();
        return code >= 0 && code < values.length ? Optional.of(values[code]) : Optional.empty();
    }

    private static String squash(String s) {
        return s.replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
    }
}
