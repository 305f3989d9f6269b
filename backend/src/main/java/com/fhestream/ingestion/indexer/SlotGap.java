package com.fhestream.ingestion.indexer;

import com.fhestream.domain.SignatureRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Distance greater than one slot between consecutive processed signatures. Informational: empty slots are normal.
 */
public record SlotGap(long fromSlot, long toSlot, String fromSignature, String toSignature) {

    public long size() {
        return toSlot - fromSlot;
    }

    /**
     * Gaps between the checkpoint and the first signature (when a checkpoint exists) and between neighbours.
     * {@code ordered} must already be in chain order.
     */
    public static List<SlotGap> detect(long lastProcessedSlot, String lastProcessedSignature, List<SignatureRef> ordered) {
        List<SlotGap> gaps = new ArrayList<>();
        if (ordered.isEmpty()) {
            return gaps;
        }
        SignatureRef first = ordered.get(0);
        if (lastProcessedSlot > 0 && first.slot() - lastProcessedSlot > 1) {
            gaps.add(new SlotGap(lastProcessedSlot, first.slot(), lastProcessedSignature, first.signature()));
        }
        for (int i = 1; i < ordered.size(); i++) {
            SignatureRef prev = ordered.get(i - 1);
            SignatureRef next = ordered.get(i);
            if (next.slot() - prev.slot() > 1) {
                gaps.add(new SlotGap(prev.slot(), next.slot(), prev.signature(), next.signature()));
            }
        }
        return gaps;
    }
}
