package com.fhestream.ingestion.logs;

import com.fhestream.common.Base58;
import com.fhestream.domain.FheOperator;
import lombok.extern.slf4j.Slf4j;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts program events from transaction log lines. Events are emitted as {@code Program data: <base64>} lines;
 * only lines written while the indexed program is the innermost invoked program are taken, so CPI callers and
 * callees cannot inject events. Truncated payloads yield a record with the fields read so far.
 */
@Slf4j
public class AnchorEventLogDecoder {

    private static final String DATA_PREFIX = "Program data: ";
    private static final Pattern INVOKE = Pattern.compile("^Program (\\S+) invoke \\[\\d+]$");
    private static final Pattern EXIT = Pattern.compile("^Program (\\S+) (success|failed.*|consumed .*)$");
    private static final int KEY_LENGTH = 32;

    private final String programId;

    public AnchorEventLogDecoder(String programId) {
        this.programId = programId;
    }

    public List<RawEventRecord> decode(List<String> logMessages) {
        List<RawEventRecord> records = new ArrayList<>();
        if (logMessages == null) {
            return records;
        }
        Deque<String> callStack = new ArrayDeque<>();
        for (String line : logMessages) {
            Matcher invoke = INVOKE.matcher(line);
            if (invoke.matches()) {
                callStack.push(invoke.group(1));
                continue;
            }
            Matcher exit = EXIT.matcher(line);
            if (exit.matches()) {
                if (exit.group(2).startsWith("consumed")) {
                    continue;
                }
                if (!callStack.isEmpty() && callStack.peek().equals(exit.group(1))) {
                    callStack.pop();
                }
                continue;
            }
            if (line.startsWith(DATA_PREFIX) && programId.equals(callStack.peek())) {
                RawEventRecord record = decodeData(line.substring(DATA_PREFIX.length()).trim());
                if (record != null) {
                    records.add(record);
                }
            }
        }
        return records;
    }

    RawEventRecord decodeData(String base64) {
        byte[] data;
        try {
            data = Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping undecodable program data line: {}", e.getMessage());
            return null;
        }
        AnchorEventLayout layout = AnchorEventLayout.forDiscriminator(data);
        if (layout == null) {
            log.debug("Skipping program data with unknown discriminator");
            return null;
        }
        ByteBuffer buffer = ByteBuffer.wrap(data, AnchorEventLayout.DISCRIMINATOR_LENGTH, data.length - AnchorEventLayout.DISCRIMINATOR_LENGTH);
        Map<String, Object> fields = new LinkedHashMap<>();
        try {
            fields.put("caller", Base58.encode(read(buffer, KEY_LENGTH)));
            if (layout.operatorType() != null) {
                int code = Byte.toUnsignedInt(buffer.get());
                fields.put("op", operatorValue(layout, code));
            }
            for (String field : layout.byteFields()) {
                fields.put(field, read(buffer, KEY_LENGTH));
            }
        } catch (BufferUnderflowException e) {
            log.warn("Truncated {} payload ({} bytes)", layout.eventName(), data.length);
        }
        return new RawEventRecord(layout.eventName(), fields);
    }

    /** Tagged form {@code {"<Variant>": {}}}, or the raw index when it is out of range. */
    private static Object operatorValue(AnchorEventLayout layout, int code) {
        FheOperator[] operators = layout.operatorType().getEnumConstants();
        if (code >= operators.length) {
            return code;
        }
        return Map.of(operators[code].name(), Map.of());
    }

    private static byte[] read(ByteBuffer buffer, int length) {
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }
}
