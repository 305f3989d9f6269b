package com.fhestream.ingestion.handler;

import com.fhestream.domain.BinaryOpRequested;
import com.fhestream.domain.Handle;
import com.fhestream.domain.HandleDependency;
import com.fhestream.domain.HandleDependencyRepository;
import com.fhestream.domain.HandleDerivation;
import com.fhestream.domain.OperationEvent;
import com.fhestream.domain.OperationLog;
import com.fhestream.domain.OperationLogRepository;
import com.fhestream.domain.TernaryOpRequested;
import com.fhestream.domain.UnaryOpRequested;
import com.fhestream.ingestion.config.IndexerProperties;
import com.fhestream.pubsub.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Records each operation in operation_log and its lineage in handle_dependencies. Both are keyed by result
 * handle, so replays overwrite instead of duplicating. When persisting fails the caller gets operation.failed.
 */
@Component
@Order(10)
@RequiredArgsConstructor
@Slf4j
public class OperationLogHandler implements IndexedEventHandler {

    private final OperationLogRepository operationLogRepository;
    private final HandleDependencyRepository handleDependencyRepository;
    private final EventPublisher eventPublisher;
    private final IndexerProperties indexerProperties;

    @Override
    public void onUnaryOpRequested(UnaryOpRequested event) {
        record(event);
    }

    @Override
    public void onBinaryOpRequested(BinaryOpRequested event) {
        record(event);
    }

    @Override
    public void onTernaryOpRequested(TernaryOpRequested event) {
        record(event);
    }

    private void record(OperationEvent event) {
        verifyResultHandle(event);
        List<String> inputs = event.inputHandles().stream().map(Handle::hex).toList();
        try {
            OperationLog entry = new OperationLog();
            entry.setResultHandle(event.resultHandle().hex());
            entry.setCaller(event.caller());
            entry.setOperationType(event.operationType());
            entry.setOperation(event.op().name());
            entry.setInputHandles(inputs);
            entry.setSignature(event.signature());
            entry.setSlot(event.slot());
            entry.setBlockTime(event.blockTime());
            entry.setIndexedAt(Instant.now());
            operationLogRepository.save(entry);

            HandleDependency dependency = new HandleDependency();
            dependency.setOutputHandle(event.resultHandle().hex());
            dependency.setInputHandles(inputs);
            dependency.setOperation(event.op().name());
            dependency.setOperationType(event.operationType());
            dependency.setSignature(event.signature());
            dependency.setSlot(event.slot());
            handleDependencyRepository.save(dependency);
        } catch (RuntimeException e) {
            eventPublisher.publishOperationFailed(event, "Failed to record operation: " + e.getMessage());
            throw e;
        }
    }

    private void verifyResultHandle(OperationEvent event) {
        String programId = indexerProperties.getProgramId();
        try {
            if (!HandleDerivation.matches(event, programId)) {
                log.warn("Result handle {} of {} in {} does not match its inputs", event.resultHandle(), event.op().name(), event.signature());
            }
        } catch (IllegalArgumentException e) {
            log.debug("Cannot verify result handle for program {}: {}", programId, e.getMessage());
        }
    }
}
