package com.fhestream.ciphertext;

import com.fhestream.config.CaffeineConfig;
import com.fhestream.domain.CiphertextRecord;
import com.fhestream.domain.CiphertextRecord.CiphertextStatus;
import com.fhestream.domain.CiphertextRecordRepository;
import com.fhestream.domain.Handle;
import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.pubsub.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Optimistic ciphertext tracking. A registration is visible immediately as OPTIMISTIC, moves to SUBMITTING once
 * the client reports a transaction, and to CONFIRMED when the indexer sees InputHandleRegistered for the handle.
 * Entries still pending after the TTL are failed by {@link #reapStale()}. Transitions that race the indexer's
 * confirmation are conditional updates, so a CONFIRMED entry is never overwritten by them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CiphertextService {

    private static final List<String> PENDING = List.of(CiphertextStatus.OPTIMISTIC.name(), CiphertextStatus.SUBMITTING.name());

    private final CiphertextRecordRepository repository;
    private final MongoTemplate mongoTemplate;
    private final EventPublisher eventPublisher;
    private final CiphertextProperties properties;
    private final Clock clock;

    /**
     * Registers an OPTIMISTIC entry and tells the owner. Registering a handle that is already tracked returns the
     * existing entry, unless it FAILED, in which case it starts over.
     */
    @CacheEvict(cacheNames = CaffeineConfig.CIPHERTEXT_CACHE, key = "#handle.hex()")
    public CiphertextRecord registerOptimistic(Handle handle, String owner, String clientTag) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
        Optional<CiphertextRecord> existing = repository.findById(handle.hex());
        if (existing.isPresent() && existing.get().getStatus() != CiphertextStatus.FAILED) {
            log.debug("Ciphertext {} already tracked as {}", handle, existing.get().getStatus());
            return existing.get();
        }
        Instant now = clock.instant();
        CiphertextRecord record = existing.orElseGet(CiphertextRecord::new);
        record.setHandle(handle.hex());
        record.setOwner(owner.trim());
        record.setClientTag(clientTag);
        record.setStatus(CiphertextStatus.OPTIMISTIC);
        record.setTxSignature(null);
        record.setFailureReason(null);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        CiphertextRecord saved = repository.save(record);
        log.info("Ciphertext {} registered optimistically for {}", handle, saved.getOwner());
        eventPublisher.publishCiphertextRegistered(saved);
        return saved;
    }

    /**
     * Records the client's registration transaction.
     *
     * @throws CiphertextNotFoundException when the handle is not tracked
     * @throws CiphertextStateException when the ciphertext is already confirmed
     */
    @CacheEvict(cacheNames = CaffeineConfig.CIPHERTEXT_CACHE, key = "#handle.hex()")
    public CiphertextRecord markSubmitting(Handle handle, String txSignature) {
        if (txSignature == null || txSignature.isBlank()) {
            throw new IllegalArgumentException("txSignature is required");
        }
        Query query = new Query(where("_id").is(handle.hex()).and("status").ne(CiphertextStatus.CONFIRMED.name()));
        Update update = new Update()
                .set("status", CiphertextStatus.SUBMITTING.name())
                .set("txSignature", txSignature.trim())
                .unset("failureReason")
                .set("updatedAt", clock.instant());
        CiphertextRecord updated = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), CiphertextRecord.class);
        if (updated != null) {
            return updated;
        }
        if (!repository.existsById(handle.hex())) {
            throw new CiphertextNotFoundException(handle.hex());
        }
        throw new CiphertextStateException("Ciphertext " + handle.hex() + " is already confirmed");
    }

    /**
     * Marks the handle CONFIRMED from its on-chain registration. Handles registered without going through this
     * service are tracked from here on. Replays of the same event leave the entry unchanged.
     */
    @CacheEvict(cacheNames = CaffeineConfig.CIPHERTEXT_CACHE, key = "#event.handle().hex()")
    public CiphertextRecord confirm(InputHandleRegistered event) {
        String hex = event.handle().hex();
        CiphertextRecord record = repository.findById(hex).orElseGet(() -> {
            CiphertextRecord created = new CiphertextRecord();
            created.setHandle(hex);
            created.setOwner(event.caller());
            created.setClientTag(event.clientTag());
            created.setCreatedAt(clock.instant());
            return created;
        });
        if (record.getStatus() == CiphertextStatus.CONFIRMED && event.signature().equals(record.getTxSignature())) {
            return record;
        }
        Instant now = clock.instant();
        record.setStatus(CiphertextStatus.CONFIRMED);
        record.setTxSignature(event.signature());
        record.setSlot(event.slot());
        record.setFailureReason(null);
        record.setConfirmedAt(now);
        record.setUpdatedAt(now);
        log.info("Ciphertext {} confirmed in slot {}", hex, event.slot());
        return repository.save(record);
    }

    @Cacheable(cacheNames = CaffeineConfig.CIPHERTEXT_CACHE, key = "#handle.hex()", unless = "#result == null")
    public Optional<CiphertextRecord> find(Handle handle) {
        return repository.findById(handle.hex());
    }

    public List<CiphertextRecord> findByOwner(String owner) {
        return repository.findByOwner(owner);
    }

    /**
     * Fails pending entries older than the TTL in one conditional update. Returns how many were failed.
     */
    @CacheEvict(cacheNames = CaffeineConfig.CIPHERTEXT_CACHE, allEntries = true)
    public int reapStale() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(properties.getPendingTtl());
        Query query = new Query(where("status").in(PENDING).and("updatedAt").lt(cutoff));
        Update update = new Update()
                .set("status", CiphertextStatus.FAILED.name())
                .set("failureReason", "Not confirmed within " + properties.getPendingTtl().toSeconds() + "s")
                .set("updatedAt", now);
        long failed = mongoTemplate.updateMulti(query, update, CiphertextRecord.class).getModifiedCount();
        if (failed > 0) {
            log.warn("Failed {} stale ciphertext registrations older than {}", failed, cutoff);
        }
        return (int) failed;
    }
}
