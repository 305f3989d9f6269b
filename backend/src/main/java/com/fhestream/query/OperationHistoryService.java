package com.fhestream.query;

import com.fhestream.config.CaffeineConfig;
import com.fhestream.domain.HandleDependency;
import com.fhestream.domain.HandleDependencyRepository;
import com.fhestream.domain.OperationLog;
import com.fhestream.domain.OperationLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only operation history and handle lineage sourced from operation_log and handle_dependencies.
 */
@Service
@RequiredArgsConstructor
public class OperationHistoryService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;
    /** Upper bound on nodes returned for one lineage walk. */
    public static final int MAX_LINEAGE_NODES = 256;

    private final MongoTemplate mongoTemplate;
    private final OperationLogRepository operationLogRepository;
    private final HandleDependencyRepository handleDependencyRepository;

    /** Caller's operations newest first. Limit is clamped to 1..100, offset to 0 and up. */
    public OperationHistoryPage findByCaller(String caller, Integer limit, Integer offset) {
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("caller is required");
        }
        int pageSize = Math.max(1, Math.min(limit == null ? DEFAULT_LIMIT : limit, MAX_LIMIT));
        int skip = Math.max(0, offset == null ? 0 : offset);
        String owner = caller.trim();

        Query query = Query.query(Criteria.where("caller").is(owner))
                .with(Sort.by(Sort.Order.desc("slot"), Sort.Order.desc("_id")))
                .skip(skip)
                .limit(pageSize);
        List<OperationHistoryItem> items = mongoTemplate.find(query, OperationLog.class).stream()
                .map(OperationHistoryService::toItem)
                .toList();
        return new OperationHistoryPage(items, operationLogRepository.countByCaller(owner), pageSize, skip);
    }

    /**
     * Producing operations of the handle and, transitively, of its inputs, nearest first. Empty when the handle
     * was not produced by an indexed operation.
     */
    @Cacheable(cacheNames = CaffeineConfig.LINEAGE_CACHE, key = "#handle", unless = "#result.isEmpty()")
    public List<LineageNode> lineage(String handle) {
        List<LineageNode> nodes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(handle);
        while (!pending.isEmpty() && nodes.size() < MAX_LINEAGE_NODES) {
            String next = pending.poll();
            if (!seen.add(next)) {
                continue;
            }
            Optional<HandleDependency> dependency = handleDependencyRepository.findById(next);
            if (dependency.isEmpty()) {
                continue;
            }
            HandleDependency edge = dependency.get();
            nodes.add(new LineageNode(edge.getOutputHandle(), edge.getOperation(),
                    edge.getOperationType() != null ? edge.getOperationType().wireName() : null,
                    edge.getInputHandles(), edge.getSignature(), edge.getSlot()));
            if (edge.getInputHandles() != null) {
                pending.addAll(edge.getInputHandles());
            }
        }
        return nodes;
    }

    private static OperationHistoryItem toItem(OperationLog entry) {
        return new OperationHistoryItem(
                entry.getResultHandle(),
                entry.getOperation(),
                entry.getOperationType() != null ? entry.getOperationType().wireName() : null,
                entry.getInputHandles(),
                entry.getSignature(),
                entry.getSlot(),
                entry.getBlockTime()
        );
    }
}
