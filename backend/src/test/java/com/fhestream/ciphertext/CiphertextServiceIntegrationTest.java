package com.fhestream.ciphertext;

import com.fhestream.domain.CiphertextRecord;
import com.fhestream.domain.CiphertextRecord.CiphertextStatus;
import com.fhestream.domain.CiphertextRecordRepository;
import com.fhestream.domain.Handle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class CiphertextServiceIntegrationTest {

    private static final String STALE = "01".repeat(32);
    private static final String CONFIRMED = "02".repeat(32);
    private static final String FRESH = "03".repeat(32);

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    CiphertextService service;
    @Autowired
    CiphertextRecordRepository repository;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("the reaper fails only pending entries past the TTL and leaves confirmed ones alone")
    void reapStale_onlyTouchesStalePendingEntries() {
        Instant old = Instant.now().minusSeconds(3600);
        repository.save(record(STALE, CiphertextStatus.OPTIMISTIC, old));
        repository.save(record(CONFIRMED, CiphertextStatus.CONFIRMED, old));
        repository.save(record(FRESH, CiphertextStatus.SUBMITTING, Instant.now()));

        assertThat(service.reapStale()).isEqualTo(1);

        CiphertextRecord stale = repository.findById(STALE).orElseThrow();
        assertThat(stale.getStatus()).isEqualTo(CiphertextStatus.FAILED);
        assertThat(stale.getFailureReason()).startsWith("Not confirmed within");
        CiphertextRecord confirmed = repository.findById(CONFIRMED).orElseThrow();
        assertThat(confirmed.getStatus()).isEqualTo(CiphertextStatus.CONFIRMED);
        assertThat(confirmed.getFailureReason()).isNull();
        assertThat(repository.findById(FRESH).orElseThrow().getStatus()).isEqualTo(CiphertextStatus.SUBMITTING);
    }

    @Test
    @DisplayName("an entry confirmed after the reaper selected its cutoff is not failed")
    void reapStale_doesNotOverwriteConfirmation() {
        Instant old = Instant.now().minusSeconds(3600);
        repository.save(record(STALE, CiphertextStatus.SUBMITTING, old));
        CiphertextRecord confirmedMeanwhile = repository.findById(STALE).orElseThrow();
        confirmedMeanwhile.setStatus(CiphertextStatus.CONFIRMED);
        repository.save(confirmedMeanwhile);

        assertThat(service.reapStale()).isZero();
        assertThat(repository.findById(STALE).orElseThrow().getStatus()).isEqualTo(CiphertextStatus.CONFIRMED);
    }

    @Test
    void markSubmitting_confirmedEntryIsLeftUnchanged() {
        CiphertextRecord confirmed = record(CONFIRMED, CiphertextStatus.CONFIRMED, Instant.now());
        confirmed.setTxSignature("chain-sig");
        repository.save(confirmed);

        assertThatThrownBy(() -> service.markSubmitting(new Handle(CONFIRMED), "client-sig"))
                .isInstanceOf(CiphertextStateException.class);
        assertThatThrownBy(() -> service.markSubmitting(new Handle(FRESH), "client-sig"))
                .isInstanceOf(CiphertextNotFoundException.class);
        assertThat(repository.findById(CONFIRMED).orElseThrow().getTxSignature()).isEqualTo("chain-sig");
    }

    @Test
    void markSubmitting_pendingEntryMovesToSubmitting() {
        CiphertextRecord optimistic = record(FRESH, CiphertextStatus.OPTIMISTIC, Instant.now().minusSeconds(5));
        optimistic.setFailureReason("stale reason");
        repository.save(optimistic);

        CiphertextRecord submitting = service.markSubmitting(new Handle(FRESH), "client-sig");

        assertThat(submitting.getStatus()).isEqualTo(CiphertextStatus.SUBMITTING);
        assertThat(submitting.getTxSignature()).isEqualTo("client-sig");
        assertThat(submitting.getFailureReason()).isNull();
        assertThat(submitting.getOwner()).isEqualTo("alice");
    }

    private static CiphertextRecord record(String handle, CiphertextStatus status, Instant updatedAt) {
        CiphertextRecord record = new CiphertextRecord();
        record.setHandle(handle);
        record.setOwner("alice");
        record.setStatus(status);
        record.setCreatedAt(updatedAt);
        record.setUpdatedAt(updatedAt);
        return record;
    }
}
