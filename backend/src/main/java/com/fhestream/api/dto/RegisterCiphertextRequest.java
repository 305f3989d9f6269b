package com.fhestream.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record RegisterCiphertextRequest(
        @NotBlank(message = "INVALID_HANDLE")
        @Pattern(regexp = "^(0x)?[0-9a-fA-F]{64}$", message = "INVALID_HANDLE")
        String handle,
        @NotBlank(message = "INVALID_OWNER")
        String owner,
        String clientTag
) {
}
