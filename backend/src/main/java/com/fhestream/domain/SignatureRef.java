package com.fhestream.domain;

import java.util.Comparator;

/**
 * A transaction signature as listed by the chain, used only for ordering and checkpointing.
 * blockTime is epoch seconds and may be absent.
 */
public record SignatureRef(String signature, long slot, Long blockTime) {

    /** Ascending by slot, then blockTime; an absent blockTime compares equal to any other. */
    public static final Comparator<SignatureRef> CHAIN_ORDER = (a, b) -> {
        int bySlot = Long.compare(a.slot(), b.slot());
        if (bySlot != 0) {
            return bySlot;
        }
        if (a.blockTime() == null || b.blockTime() == null) {
            return 0;
        }
        return Long.compare(a.blockTime(), b.blockTime());
    };
}
