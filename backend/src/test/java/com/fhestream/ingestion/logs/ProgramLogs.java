package com.fhestream.ingestion.logs;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

/**
 * Builds program log lines the way the validator prints them, with Borsh-encoded event payloads.
 */
public final class ProgramLogs {

    private ProgramLogs() {
    }

    /** Base64 payload: discriminator of {@code eventName} followed by the parts. */
    public static String payload(String eventName, byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(AnchorEventLayout.discriminatorOf(eventName));
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    /** One top-level invocation of the program that emits the given payloads. */
    public static List<String> invocation(String programId, String... payloads) {
        List<String> lines = new ArrayList<>();
        lines.add("Program " + programId + " invoke [1]");
        for (String payload : payloads) {
            lines.add("Program data: " + payload);
        }
        lines.add("Program " + programId + " consumed 5000 of 200000 compute units");
        lines.add("Program " + programId + " success");
        return lines;
    }

    public static byte[] filled(int length, int value) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }

    public static String registration(byte[] caller, byte[] handle, byte[] clientTag) {
        return payload("InputHandleRegistered", caller, handle, clientTag);
    }

    public static String binaryOp(byte[] caller, int opCode, byte[] lhs, byte[] rhs, byte[] result) {
        return payload("Fhe16BinaryOpRequested", caller, new byte[]{(byte) opCode}, lhs, rhs, result);
    }
}
