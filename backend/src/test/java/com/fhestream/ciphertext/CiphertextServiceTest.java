package com.fhestream.ciphertext;

import com.fhestream.domain.CiphertextRecord;
import com.fhestream.domain.CiphertextRecord.CiphertextStatus;
import com.fhestream.domain.CiphertextRecordRepository;
import com.fhestream.domain.Handle;
import com.fhestream.domain.InputHandleRegistered;
import com.fhestream.pubsub.EventPublisher;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CiphertextServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final Handle HANDLE = new Handle("ab".repeat(32));

    @Mock
    CiphertextRecordRepository repository;
    @Mock
    MongoTemplate mongoTemplate;
    @Mock
    EventPublisher eventPublisher;

    private CiphertextService service;

    @BeforeEach
    void setUp() {
        CiphertextProperties properties = new CiphertextProperties();
        properties.setPendingTtl(Duration.ofSeconds(180));
        service = new CiphertextService(repository, mongoTemplate, eventPublisher, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("registering a new handle stores it as OPTIMISTIC and notifies the owner")
    void registerOptimistic_newHandle() {
        when(repository.findById(HANDLE.hex())).thenReturn(Optional.empty());
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        CiphertextRecord record = service.registerOptimistic(HANDLE, " alice ", "tag");

        assertThat(record.getStatus()).isEqualTo(CiphertextStatus.OPTIMISTIC);
        assertThat(record.getOwner()).isEqualTo("alice");
        assertThat(record.getCreatedAt()).isEqualTo(NOW);
        verify(eventPublisher).publishCiphertextRegistered(record);
    }

    @Test
    void registerOptimistic_existingPendingEntryIsReturnedUnchanged() {
        CiphertextRecord existing = record(CiphertextStatus.SUBMITTING, NOW.minusSeconds(10));
        when(repository.findById(HANDLE.hex())).thenReturn(Optional.of(existing));

        CiphertextRecord record = service.registerOptimistic(HANDLE, "alice", "tag");

        assertThat(record).isSameAs(existing);
        assertThat(record.getStatus()).isEqualTo(CiphertextStatus.SUBMITTING);
        verify(repository, never()).save(any());
        verify(eventPublisher, never()).publishCiphertextRegistered(any());
    }

    @Test
    void registerOptimistic_failedEntryStartsOver() {
        CiphertextRecord failed = record(CiphertextStatus.FAILED, NOW.minusSeconds(600));
        failed.setFailureReason("Not confirmed within 180s");
        failed.setTxSignature("old-sig");
        when(repository.findById(HANDLE.hex())).thenReturn(Optional.of(failed));
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        CiphertextRecord record = service.registerOptimistic(HANDLE, "alice", "tag");

        assertThat(record.getStatus()).isEqualTo(CiphertextStatus.OPTIMISTIC);
        assertThat(record.getFailureReason()).isNull();
        assertThat(record.getTxSignature()).isNull();
    }

    @Test
    void registerOptimistic_requiresOwner() {
        assertThatThrownBy(() -> service.registerOptimistic(HANDLE, " ", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void markSubmitting_recordsSignature() {
        CiphertextRecord submitting = record(CiphertextStatus.SUBMITTING, NOW);
        submitting.setTxSignature("tx-sig");
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(CiphertextRecord.class))).thenReturn(submitting);

        CiphertextRecord record = service.markSubmitting(HANDLE, " tx-sig ");

        assertThat(record).isSameAs(submitting);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).findAndModify(query.capture(), update.capture(), any(FindAndModifyOptions.class),
                eq(CiphertextRecord.class));
        Document filter = query.getValue().getQueryObject();
        assertThat(filter.get("_id")).isEqualTo(HANDLE.hex());
        assertThat(filter.get("status", Document.class).get("$ne")).isEqualTo("CONFIRMED");
        Document set = update.getValue().getUpdateObject().get("$set", Document.class);
        assertThat(set.get("status")).isEqualTo("SUBMITTING");
        assertThat(set.get("txSignature")).isEqualTo("tx-sig");
        assertThat(set.get("updatedAt")).isEqualTo(NOW);
        verify(repository, never()).save(any());
    }

    @Test
    void markSubmitting_unknownHandle() {
        when(repository.existsById(HANDLE.hex())).thenReturn(false);

        assertThatThrownBy(() -> service.markSubmitting(HANDLE, "tx-sig"))
                .isInstanceOf(CiphertextNotFoundException.class);
    }

    @Test
    @DisplayName("a handle that is already confirmed is not moved back to SUBMITTING")
    void markSubmitting_confirmedHandleIsRejected() {
        when(repository.existsById(HANDLE.hex())).thenReturn(true);

        assertThatThrownBy(() -> service.markSubmitting(HANDLE, "tx-sig"))
                .isInstanceOf(CiphertextStateException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void markSubmitting_requiresSignature() {
        assertThatThrownBy(() -> service.markSubmitting(HANDLE, " "))
                .isInstanceOf(IllegalArgumentException.class);
        verify(mongoTemplate, never()).findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(CiphertextRecord.class));
    }

    @Test
    @DisplayName("an indexed registration confirms the tracked entry")
    void confirm_tracked() {
        when(repository.findById(HANDLE.hex())).thenReturn(Optional.of(record(CiphertextStatus.SUBMITTING, NOW.minusSeconds(5))));
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        CiphertextRecord record = service.confirm(registration("chain-sig"));

        assertThat(record.getStatus()).isEqualTo(CiphertextStatus.CONFIRMED);
        assertThat(record.getTxSignature()).isEqualTo("chain-sig");
        assertThat(record.getSlot()).isEqualTo(900L);
        assertThat(record.getConfirmedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("an indexed registration nobody announced is tracked from confirmation on")
    void confirm_untrackedHandle() {
        when(repository.findById(HANDLE.hex())).thenReturn(Optional.empty());
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));

        CiphertextRecord record = service.confirm(registration("chain-sig"));

        assertThat(record.getHandle()).isEqualTo(HANDLE.hex());
        assertThat(record.getOwner()).isEqualTo("alice");
        assertThat(record.getClientTag()).isEqualTo("tag");
        assertThat(record.getStatus()).isEqualTo(CiphertextStatus.CONFIRMED);
    }

    @Test
    void confirm_replayIsANoOp() {
        CiphertextRecord confirmed = record(CiphertextStatus.CONFIRMED, NOW.minusSeconds(60));
        confirmed.setTxSignature("chain-sig");
        when(repository.findById(HANDLE.hex())).thenReturn(Optional.of(confirmed));

        CiphertextRecord record = service.confirm(registration("chain-sig"));

        assertThat(record.getUpdatedAt()).isEqualTo(NOW.minusSeconds(60));
        verify(repository, never()).save(any());
    }

    @Test
    @DisplayName("pending entries past the TTL are failed by one update that only matches pending statuses")
    void reapStale_failsExpiredPendingEntries() {
        when(mongoTemplate.updateMulti(any(Query.class), any(Update.class), eq(CiphertextRecord.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        int reaped = service.reapStale();

        assertThat(reaped).isEqualTo(1);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateMulti(query.capture(), update.capture(), eq(CiphertextRecord.class));
        Document filter = query.getValue().getQueryObject();
        assertThat((List<Object>) filter.get("status", Document.class).get("$in")).containsExactly("OPTIMISTIC", "SUBMITTING");
        assertThat(filter.get("updatedAt", Document.class).get("$lt")).isEqualTo(NOW.minusSeconds(180));
        Document set = update.getValue().getUpdateObject().get("$set", Document.class);
        assertThat(set.get("status")).isEqualTo("FAILED");
        assertThat(set.get("failureReason")).isEqualTo("Not confirmed within 180s");
        assertThat(set.get("updatedAt")).isEqualTo(NOW);
        verify(repository, never()).saveAll(any());
    }

    @Test
    void reapStale_nothingToDo() {
        when(mongoTemplate.updateMulti(any(Query.class), any(Update.class), eq(CiphertextRecord.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(service.reapStale()).isZero();
    }

    private static CiphertextRecord record(CiphertextStatus status, Instant updatedAt) {
        CiphertextRecord record = new CiphertextRecord();
        record.setHandle(HANDLE.hex());
        record.setOwner("alice");
        record.setClientTag("tag");
        record.setStatus(status);
        record.setCreatedAt(updatedAt);
        record.setUpdatedAt(updatedAt);
        return record;
    }

    private static InputHandleRegistered registration(String signature) {
        return new InputHandleRegistered(signature, 900, 1_700_000_000L, "alice", HANDLE, "tag");
    }
}
