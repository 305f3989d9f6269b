package com.fhestream.domain;

import java.util.List;

public record BinaryOpRequested(String signature, long slot, Long blockTime, String caller,
                                BinaryOperator op, Handle lhsHandle, Handle rhsHandle, Handle resultHandle) implements OperationEvent {

    @Override
    public EventKind kind() {
        return EventKind.BINARY_OP_REQUESTED;
    }

    @Override
    public List<Handle> inputHandles() {
        return List.of(lhsHandle, rhsHandle);
    }
}
