package com.fhestream.api.dto;

import com.fhestream.domain.CiphertextRecord;

import java.time.Instant;

public record CiphertextResponse(
        String handle,
        String owner,
        String clientTag,
        String status,
        String txSignature,
        Long slot,
        String failureReason,
        Instant createdAt,
        Instant updatedAt,
        Instant confirmedAt
) {

    public static CiphertextResponse from(CiphertextRecord record) {
        return new CiphertextResponse(
                record.getHandle(),
                record.getOwner(),
                record.getClientTag(),
                record.getStatus() != null ? record.getStatus().name() : null,
                record.getTxSignature(),
                record.getSlot(),
                record.getFailureReason(),
                record.getCreatedAt(),
                record.getUpdatedAt(),
                record.getConfirmedAt()
        );
    }
}
