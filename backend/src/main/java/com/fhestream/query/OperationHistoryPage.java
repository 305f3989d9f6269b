package com.fhestream.query;

import java.util.List;

public record OperationHistoryPage(List<OperationHistoryItem> items, long total, int limit, int offset) {

    public boolean hasMore() {
        return offset + items.size() < total;
    }
}
