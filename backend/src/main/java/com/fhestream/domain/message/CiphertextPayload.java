package com.fhestream.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Payload of user.ciphertext.registered and user.ciphertext.confirmed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CiphertextPayload(String handle, String owner, String clientTag, String signature, Long slot, Long blockTime) {
}
