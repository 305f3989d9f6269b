package com.fhestream.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Tracked ciphertext registration. Goes OPTIMISTIC -> SUBMITTING -> CONFIRMED, or to FAILED when it goes stale.
 */
@Document(collection = "ciphertexts")
@CompoundIndex(name = "status_updated", def = "{'status': 1, 'updatedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CiphertextRecord {

    /** Handle hex. */
    @Id
    @EqualsAndHashCode.Include
    private String handle;
    @Indexed
    private String owner;
    private String clientTag;
    private CiphertextStatus status;
    private String txSignature;
    private Long slot;
    private String failureReason;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant confirmedAt;

    public enum CiphertextStatus {
        OPTIMISTIC,
        SUBMITTING,
        CONFIRMED,
        FAILED
    }
}
