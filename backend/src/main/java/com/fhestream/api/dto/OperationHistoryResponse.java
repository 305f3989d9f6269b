package com.fhestream.api.dto;

import com.fhestream.query.OperationHistoryItem;

import java.util.List;

/**
 * Offset-paginated operation history, newest first.
 */
public record OperationHistoryResponse(
        String caller,
        List<OperationHistoryItem> items,
        long total,
        int limit,
        int offset,
        boolean hasMore
) {
}
