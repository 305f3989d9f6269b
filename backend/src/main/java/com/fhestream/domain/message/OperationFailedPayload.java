package com.fhestream.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationFailedPayload(String operation, String operationType, String resultHandle, String owner,
                                     String signature, long slot, String error) {
}
