package com.fhestream.domain;

import java.util.List;

public record UnaryOpRequested(String signature, long slot, Long blockTime, String caller,
                               UnaryOperator op, Handle inputHandle, Handle resultHandle) implements OperationEvent {

    @Override
    public EventKind kind() {
        return EventKind.UNARY_OP_REQUESTED;
    }

    @Override
    public List<Handle> inputHandles() {
        return List.of(inputHandle);
    }
}
