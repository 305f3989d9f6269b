package com.fhestream.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SubmitCiphertextRequest(@NotBlank(message = "INVALID_SIGNATURE") String txSignature) {
}
