package com.fhestream.ingestion.indexer;

import com.fhestream.checkpoint.CheckpointStore;
import com.fhestream.checkpoint.CheckpointWriteException;
import com.fhestream.common.RetryPolicy;
import com.fhestream.common.Sleeper;
import com.fhestream.domain.IndexedEvent;
import com.fhestream.domain.SignatureRef;
import com.fhestream.ingestion.config.IndexerMode;
import com.fhestream.ingestion.handler.EventDispatcher;
import com.fhestream.ingestion.logs.AnchorEventLogDecoder;
import com.fhestream.ingestion.logs.RawEventRecord;
import com.fhestream.ingestion.normalizer.EventNormalizer;
import com.fhestream.ingestion.normalizer.TransactionContext;
import com.fhestream.ingestion.rpc.FetchedTransaction;
import com.fhestream.ingestion.rpc.RpcException;
import com.fhestream.ingestion.rpc.RpcTierPolicy;
import com.fhestream.ingestion.rpc.SignatureInfo;
import com.fhestream.ingestion.rpc.SolanaProgramRpc;
import com.fhestream.pubsub.EventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Follows one program: discovers its new transactions, processes them strictly in chain order and advances the
 * checkpoint after each one. Polling cycles never overlap: the next cycle is scheduled only after the current one
 * has finished. Push mode is a latency optimisation only; it demotes itself to polling after repeated failures.
 */
@Slf4j
public class ProgramIndexer {

    static final int INITIAL_SLOT_ATTEMPTS = 3;
    static final long INITIAL_SLOT_RETRY_MS = 1000L;
    /** Cycles a transaction may fail to fetch before it is skipped and the checkpoint moves past it. */
    static final int MAX_FETCH_ATTEMPTS = 3;
    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final String programId;
    private final SolanaProgramRpc rpc;
    private final RpcTierPolicy policy;
    private final CheckpointStore checkpointStore;
    private final AnchorEventLogDecoder decoder;
    private final EventNormalizer normalizer;
    private final EventDispatcher dispatcher;
    private final EventPublisher eventPublisher;
    private final TaskScheduler scheduler;
    private final LogsSubscriptionClient logsClient;
    private final IndexerMode preferredMode;
    private final String commitment;
    private final int pageSize;
    private final Sleeper sleeper;
    private final RetryPolicy reconnectPolicy;

    private final Object lifecycleLock = new Object();
    private final ReentrantLock processingLock = new ReentrantLock();
    private final Map<String, Integer> fetchFailures = new HashMap<>();
    private volatile boolean running;
    private volatile IndexerMode currentMode = IndexerMode.POLLING;
    private volatile long lastProcessedSlot;
    private volatile String lastProcessedSignature;
    private volatile int reconnectAttempts;
    private ScheduledFuture<?> scheduledTask;
    private Disposable pushSubscription;

    public ProgramIndexer(String programId,
                          SolanaProgramRpc rpc,
                          RpcTierPolicy policy,
                          CheckpointStore checkpointStore,
                          AnchorEventLogDecoder decoder,
                          EventNormalizer normalizer,
                          EventDispatcher dispatcher,
                          EventPublisher eventPublisher,
                          TaskScheduler scheduler,
                          LogsSubscriptionClient logsClient,
                          IndexerMode preferredMode,
                          String commitment,
                          int pageSize,
                          Sleeper sleeper,
                          RetryPolicy reconnectPolicy) {
        this.programId = programId;
        this.rpc = rpc;
        this.policy = policy;
        this.checkpointStore = checkpointStore;
        this.decoder = decoder;
        this.normalizer = normalizer;
        this.dispatcher = dispatcher;
        this.eventPublisher = eventPublisher;
        this.scheduler = scheduler;
        this.logsClient = logsClient;
        this.preferredMode = logsClient == null ? IndexerMode.POLLING : preferredMode;
        this.commitment = commitment;
        this.pageSize = Math.min(Math.max(1, pageSize), SolanaProgramRpc.MAX_SIGNATURES_LIMIT);
        this.sleeper = sleeper;
        this.reconnectPolicy = reconnectPolicy;
    }

    /**
     * Restores the checkpoint and starts the preferred mode. Without a checkpoint, indexing starts at the current
     * chain height; earlier history is not replayed.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.warn("Indexer for {} already running", programId);
                return;
            }
            lastProcessedSlot = checkpointStore.getLastSlot(programId);
            lastProcessedSignature = checkpointStore.getLastSignature(programId).orElse(null);
            log.info("Starting indexer for {} on {} ({} tier, poll {} ms, {} pages/cycle) from slot {}",
                    programId, rpc.getEndpoint(), policy.tier(), policy.pollIntervalMs(), policy.maxPagesPerCycle(), lastProcessedSlot);
            running = true;
            reconnectAttempts = 0;
            if (preferredMode == IndexerMode.PUSH) {
                startPush();
            } else {
                startPolling();
            }
        }
        eventPublisher.publishStatus("running", lastProcessedSlot, lastProcessedSignature);
    }

    /**
     * Cancels the pending cycle and the push subscription and waits for an in-flight cycle to finish.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            cancelScheduledTask();
            disposePush();
        }
        try {
            if (processingLock.tryLock(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                processingLock.unlock();
            } else {
                log.warn("Indexer for {} stopped while a cycle was still running", programId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Indexer for {} stopped at slot {}", programId, lastProcessedSlot);
        eventPublisher.publishStatus("stopped", lastProcessedSlot, lastProcessedSignature);
    }

    public IndexerStats stats() {
        return new IndexerStats(programId, rpc.getEndpoint(), policy.tier(), policy.pollIntervalMs(), lastProcessedSlot,
                lastProcessedSignature, currentMode, running, reconnectAttempts);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One polling cycle.
     *
     * @return number of transactions whose checkpoint was written
     * @throws CheckpointWriteException when the checkpoint could not be written; the rest of the cycle is abandoned
     */
    public int pollOnce() {
        processingLock.lock();
        try {
            long currentSlot = rpc.getSlot();
            if (lastProcessedSlot == 0) {
                lastProcessedSlot = currentSlot;
                log.info("No checkpoint for {}, starting at current slot {}", programId, currentSlot);
                return 0;
            }
            if (currentSlot <= lastProcessedSlot) {
                return 0;
            }
            List<SignatureRef> pending = collectNewSignatures();
            if (pending.isEmpty()) {
                return 0;
            }
            pending.sort(SignatureRef.CHAIN_ORDER);
            for (SlotGap gap : SlotGap.detect(lastProcessedSlot, lastProcessedSignature, pending)) {
                log.warn("Slot gap {} -> {} ({} slots) between {} and {}",
                        gap.fromSlot(), gap.toSlot(), gap.size(), gap.fromSignature(), gap.toSignature());
            }
            log.info("Found {} new transaction(s) for {} after slot {}", pending.size(), programId, lastProcessedSlot);
            int processed = 0;
            for (SignatureRef ref : pending) {
                if (processTransaction(ref)) {
                    fetchFailures.remove(ref.signature());
                    processed++;
                    continue;
                }
                int failures = fetchFailures.merge(ref.signature(), 1, Integer::sum);
                if (failures < MAX_FETCH_ATTEMPTS) {
                    log.warn("Holding checkpoint at slot {} for {} until {} can be fetched ({}/{})",
                            lastProcessedSlot, programId, ref.signature(), failures, MAX_FETCH_ATTEMPTS);
                    break;
                }
                log.error("Skipping transaction {} in slot {} after {} failed fetches; its events are not indexed",
                        ref.signature(), ref.slot(), failures);
                fetchFailures.remove(ref.signature());
                advanceCheckpoint(ref);
                processed++;
            }
            return processed;
        } finally {
            processingLock.unlock();
        }
    }

    /**
     * Pages backwards from the newest signature until history runs out, a page reaches the checkpoint, or the
     * tier's page cap is hit. Failed transactions are skipped; they emit no events.
     */
    List<SignatureRef> collectNewSignatures() {
        List<SignatureRef> collected = new ArrayList<>();
        String before = null;
        int pages = 0;
        while (pages < policy.maxPagesPerCycle()) {
            List<SignatureInfo> page = rpc.getSignaturesPage(programId, before, pageSize);
            pages++;
            if (page.isEmpty()) {
                return collected;
            }
            for (SignatureInfo info : page) {
                if (info.slot() > lastProcessedSlot && !info.failed()) {
                    collected.add(info.toRef());
                }
            }
            SignatureInfo oldest = page.get(page.size() - 1);
            if (oldest.slot() <= lastProcessedSlot || page.size() < pageSize) {
                return collected;
            }
            before = oldest.signature();
        }
        log.warn("Reached page cap ({}) for {}; older transactions after slot {} may be missed", policy.maxPagesPerCycle(), programId, lastProcessedSlot);
        return collected;
    }

    /**
     * Fetches, decodes and dispatches one transaction, then writes the checkpoint. A transaction the node does not
     * know is skipped with a warning and still advances the checkpoint.
     *
     * @return false when the fetch failed and the checkpoint was left where it was
     */
    boolean processTransaction(SignatureRef ref) {
        Optional<FetchedTransaction> fetched;
        try {
            fetched = rpc.getTransaction(ref.signature());
        } catch (RpcException e) {
            log.error("Failed to fetch transaction {} in slot {}: {}", ref.signature(), ref.slot(), e.getMessage());
            return false;
        }
        if (fetched.isEmpty()) {
            log.warn("Transaction not found, skipping: {}", ref.signature());
        } else if (fetched.get().logMessages() == null) {
            log.warn("Transaction has no log messages: {}", ref.signature());
        } else {
            FetchedTransaction tx = fetched.get();
            Long blockTime = tx.blockTime() != null ? tx.blockTime() : ref.blockTime();
            TransactionContext context = new TransactionContext(ref.signature(), ref.slot(), blockTime, tx.feePayer());
            for (RawEventRecord raw : decoder.decode(tx.logMessages())) {
                Optional<IndexedEvent> event = normalizer.normalize(raw, context);
                event.ifPresent(dispatcher::dispatch);
            }
        }
        advanceCheckpoint(ref);
        return true;
    }

    private void advanceCheckpoint(SignatureRef ref) {
        if (ref.slot() < lastProcessedSlot) {
            log.debug("Not moving checkpoint back from {} to {}", lastProcessedSlot, ref.slot());
            return;
        }
        checkpointStore.upsertCheckpoint(programId, ref.slot(), ref.signature());
        lastProcessedSlot = ref.slot();
        lastProcessedSignature = ref.signature();
    }

    private void startPolling() {
        currentMode = IndexerMode.POLLING;
        if (lastProcessedSlot == 0) {
            initializeFromChainHead();
        }
        scheduleCycle(Instant.now());
    }

    private void initializeFromChainHead() {
        for (int attempt = 1; attempt <= INITIAL_SLOT_ATTEMPTS; attempt++) {
            try {
                lastProcessedSlot = rpc.getSlot();
                log.info("Initial slot for {} set to {}", programId, lastProcessedSlot);
                return;
            } catch (RpcException e) {
                log.warn("Failed to get initial slot ({}/{}): {}", attempt, INITIAL_SLOT_ATTEMPTS, e.getMessage());
                if (attempt < INITIAL_SLOT_ATTEMPTS) {
                    pause(INITIAL_SLOT_RETRY_MS);
                }
            }
        }
        log.error("Could not read the chain height for {}; the first cycle will retry", programId);
    }

    private void scheduleCycle(Instant at) {
        synchronized (lifecycleLock) {
            if (running && currentMode == IndexerMode.POLLING) {
                scheduledTask = scheduler.schedule(this::runCycle, at);
            }
        }
    }

    private void runCycle() {
        if (!running) {
            return;
        }
        try {
            pollOnce();
        } catch (CheckpointWriteException e) {
            log.error("Checkpoint write failed for {}, cycle abandoned", programId, e);
            eventPublisher.publishError(lastProcessedSlot, lastProcessedSignature, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Polling cycle failed for {}", programId, e);
            eventPublisher.publishError(lastProcessedSlot, lastProcessedSignature, e.getMessage());
        } finally {
            scheduleCycle(Instant.now().plusMillis(policy.pollIntervalMs()));
        }
    }

    private void startPush() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            currentMode = IndexerMode.PUSH;
            log.info("Subscribing to logs of {} (attempt {})", programId, reconnectAttempts + 1);
            pushSubscription = logsClient.subscribe(programId, commitment, () -> reconnectAttempts = 0)
                    .publishOn(Schedulers.boundedElastic())
                    .subscribe(this::onNotification,
                            this::onPushFailure,
                            () -> onPushFailure(new IllegalStateException("logs subscription completed")));
        }
    }

    private void onNotification(LogsNotification notification) {
        if (!running || notification.failed()) {
            return;
        }
        processingLock.lock();
        try {
            if (notification.slot() > 0 && notification.slot() < lastProcessedSlot) {
                log.debug("Ignoring late notification {} in slot {}", notification.signature(), notification.slot());
                return;
            }
            if (!processTransaction(new SignatureRef(notification.signature(), notification.slot(), null))) {
                log.warn("Pushed transaction {} could not be fetched and was not indexed", notification.signature());
            }
        } catch (RuntimeException e) {
            log.error("Failed to process pushed transaction {}", notification.signature(), e);
            eventPublisher.publishError(lastProcessedSlot, lastProcessedSignature, e.getMessage());
        } finally {
            processingLock.unlock();
        }
    }

    private void onPushFailure(Throwable error) {
        if (!running) {
            return;
        }
        reconnectAttempts++;
        log.warn("Logs subscription for {} failed ({}/{}): {}", programId, reconnectAttempts, reconnectPolicy.getMaxAttempts(), error.getMessage());
        synchronized (lifecycleLock) {
            disposePush();
            if (!running) {
                return;
            }
            if (!reconnectPolicy.canRetry(reconnectAttempts)) {
                log.warn("Giving up on push mode for {} after {} attempts, switching to polling", programId, reconnectPolicy.getMaxAttempts());
                startPolling();
                return;
            }
            long delay = reconnectPolicy.delayMs(reconnectAttempts - 1);
            scheduledTask = scheduler.schedule(this::startPush, Instant.now().plusMillis(delay));
        }
    }

    private void cancelScheduledTask() {
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
    }

    private void disposePush() {
        if (pushSubscription != null) {
            pushSubscription.dispose();
            pushSubscription = null;
        }
    }

    private void pause(long millis) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted while waiting for the chain height", e);
        }
    }
}
