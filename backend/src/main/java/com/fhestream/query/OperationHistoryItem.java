package com.fhestream.query;

import java.util.List;

/**
 * One operation in a caller's history.
 */
public record OperationHistoryItem(
        String resultHandle,
        String operation,
        String operationType,
        List<String> inputHandles,
        String signature,
        long slot,
        Long blockTime
) {
}
