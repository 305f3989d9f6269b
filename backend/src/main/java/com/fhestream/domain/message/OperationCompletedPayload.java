package com.fhestream.domain.message;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationCompletedPayload(String operation, String operationType, List<String> inputHandles,
                                        String resultHandle, String owner, String signature, long slot, Long blockTime) {
}
