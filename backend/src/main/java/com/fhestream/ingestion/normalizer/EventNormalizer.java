package com.fhestream.ingestion.normalizer;

import com.fhestream.domain.BinaryOpRequested;
import com.fhestream.domain.BinaryOperator;
import com.fhestream.domain.EventKind;
import com.fhestream.domain.FheOperator;
import com.fhestream.domain.Handle;
import com.fhestream.domain.IndexedEvent;
import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.domain.TernaryOpRequested;
import com.fhestream.domain.TernaryOperator;
import com.fhestream.domain.UnaryOpRequested;
import com.fhestream.domain.UnaryOperator;
import com.fhestream.ingestion.logs.RawEventRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw decoded records into typed events. Keys are canonicalized to snake_case once on entry, so
 * {@code lhsHandle} and {@code lhs_handle} are the same field; names are canonicalized to PascalCase without the
 * {@code Fhe16} prefix. A record that fails validation is dropped with a warning and never reaches handlers.
 */
@Slf4j
public class EventNormalizer {

    static final String UNKNOWN_CALLER = "unknown";
    private static final String LEGACY_PREFIX = "Fhe16";

    public Optional<IndexedEvent> normalize(RawEventRecord raw, TransactionContext tx) {
        Optional<EventKind> kind = kindOf(raw.name());
        if (kind.isEmpty()) {
            log.warn("Dropping unknown event '{}' in {}", raw.name(), tx.signature());
            return Optional.empty();
        }
        try {
            return Optional.of(build(kind.get(), canonicalKeys(raw.data()), tx));
        } catch (MalformedEventException e) {
            log.warn("Dropping malformed {} in {}: {}", kind.get().eventName(), tx.signature(), e.getMessage());
            return Optional.empty();
        }
    }

    private IndexedEvent build(EventKind kind, Map<String, Object> data, TransactionContext tx) {
        String caller = caller(data, tx);
        return switch (kind) {
            case INPUT_HANDLE_REGISTERED -> new InputHandleRegistered(tx.signature(), tx.slot(), tx.blockTime(), caller,
                    handle(data, "handle"), Handle.of(bytes32(data, "client_tag")).hex());
            case UNARY_OP_REQUESTED -> new UnaryOpRequested(tx.signature(), tx.slot(), tx.blockTime(), caller,
                    operator(data, UnaryOperator.class), handle(data, "input_handle"), handle(data, "result_handle"));
            case BINARY_OP_REQUESTED -> new BinaryOpRequested(tx.signature(), tx.slot(), tx.blockTime(), caller,
                    operator(data, BinaryOperator.class), handle(data, "lhs_handle"), handle(data, "rhs_handle"),
                    handle(data, "result_handle"));
            case TERNARY_OP_REQUESTED -> new TernaryOpRequested(tx.signature(), tx.slot(), tx.blockTime(), caller,
                    operator(data, TernaryOperator.class), handle(data, "a_handle"), handle(data, "b_handle"),
                    handle(data, "c_handle"), handle(data, "result_handle"));
        };
    }

    static Optional<EventKind> kindOf(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String pascal = toPascalCase(name);
        if (pascal.startsWith(LEGACY_PREFIX)) {
            pascal = pascal.substring(LEGACY_PREFIX.length());
        }
        String canonical = pascal;
        return Arrays.stream(EventKind.values()).filter(k -> k.eventName().equals(canonical)).findFirst();
    }

    static String toPascalCase(String name) {
        StringBuilder out = new StringBuilder(name.length());
        boolean upperNext = true;
        for (char c : name.toCharArray()) {
            if (c == '_' || c == '-' || c == ' ' || c == '.') {
                upperNext = true;
            } else if (upperNext) {
                out.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    static String toSnakeCase(String key) {
        StringBuilder out = new StringBuilder(key.length() + 4);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && key.charAt(i - 1) != '_') {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static Map<String, Object> canonicalKeys(Map<String, Object> data) {
        Map<String, Object> canonical = new HashMap<>();
        if (data == null) {
            return canonical;
        }
        data.forEach((key, value) -> canonical.putIfAbsent(toSnakeCase(key), value));
        return canonical;
    }

    private static String caller(Map<String, Object> data, TransactionContext tx) {
        Object caller = data.get("caller");
        if (caller instanceof String s && !s.isBlank()) {
            return s;
        }
        if (caller != null && !(caller instanceof String)) {
            return caller.toString();
        }
        return tx.feePayer() != null ? tx.feePayer() : UNKNOWN_CALLER;
    }

    private static Handle handle(Map<String, Object> data, String field) {
        return Handle.of(bytes32(data, field));
    }

    private static byte[] bytes32(Map<String, Object> data, String field) {
        Object value = data.get(field);
        if (value == null) {
            throw new MalformedEventException("missing " + field);
        }
        byte[] bytes = toBytes(value, field);
        if (bytes.length != Handle.LENGTH) {
            throw new MalformedEventException(field + " has " + bytes.length + " bytes, expected " + Handle.LENGTH);
        }
        return bytes;
    }

    private static byte[] toBytes(Object value, String field) {
        if (value instanceof byte[] b) {
            return b;
        }
        if (value instanceof Handle h) {
            return h.bytes();
        }
        if (value instanceof List<?> list) {
            byte[] out = new byte[list.size()];
            for (int i = 0; i < list.size(); i++) {
                if (!(list.get(i) instanceof Number n) || n.intValue() < 0 || n.intValue() > 255) {
                    throw new MalformedEventException(field + "[" + i + "] is not a byte");
                }
                out[i] = (byte) n.intValue();
            }
            return out;
        }
        if (value instanceof String s) {
            String hex = s.startsWith("0x") ? s.substring(2) : s;
            try {
                return HexFormat.of().parseHex(hex);
            } catch (IllegalArgumentException e) {
                throw new MalformedEventException(field + " is not hex");
            }
        }
        throw new MalformedEventException(field + " has unsupported type " + value.getClass().getSimpleName());
    }

    /** Plain value ("add", 3) or single-key tagged object ({"add": {}}). */
    private static <E extends Enum<E> & FheOperator> E operator(Map<String, Object> data, Class<E> type) {
        Object raw = data.get("op");
        if (raw instanceof Map<?, ?> tagged) {
            if (tagged.size() != 1) {
                throw new MalformedEventException("op must have exactly one variant, got " + tagged.keySet());
            }
            raw = tagged.keySet().iterator().next();
        }
        if (raw instanceof Number code) {
            return FheOperator.byCode(type, code.intValue())
                    .orElseThrow(() -> new MalformedEventException("unknown " + type.getSimpleName() + " code " + code));
        }
        if (raw instanceof String name) {
            return FheOperator.lookup(type, name)
                    .orElseThrow(() -> new MalformedEventException("unknown " + type.getSimpleName() + " '" + name + "'"));
        }
        throw new MalformedEventException("missing op");
    }
}
