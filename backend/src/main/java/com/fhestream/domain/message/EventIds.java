package com.fhestream.domain.message;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event id formats. Chain-derived: {@code <slot, 12 digits>-<signature prefix>-<epoch ms, 13 digits>-<seq, 4 digits>};
 * status: {@code <epoch ms, 13 digits>-<random base36>}. Zero padding keeps chain-derived ids sorting by slot,
 * the sequence keeps messages built from one transaction in the same millisecond distinct.
 */
public final class EventIds {

    private static final int SIGNATURE_PREFIX = 8;
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private EventIds() {
    }

    public static String forTransaction(long slot, String signature, long epochMillis) {
        String prefix = signature.length() > SIGNATURE_PREFIX ? signature.substring(0, SIGNATURE_PREFIX) : signature;
        int seq = Math.floorMod(SEQUENCE.getAndIncrement(), 10_000);
        return String.format("%012d-%s-%013d-%04d", slot, prefix, epochMillis, seq);
    }

    public static String forStatus(long epochMillis) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(36L * 36 * 36 * 36 * 36, 36L * 36 * 36 * 36 * 36 * 36), 36);
        return String.format("%013d-%s", epochMillis, random);
    }
}
