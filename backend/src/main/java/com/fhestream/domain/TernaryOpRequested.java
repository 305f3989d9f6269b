package com.fhestream.domain;

import java.util.List;

public record TernaryOpRequested(String signature, long slot, Long blockTime, String caller,
                                 TernaryOperator op, Handle aHandle, Handle bHandle, Handle cHandle,
                                 Handle resultHandle) implements OperationEvent {

    @Override
    public EventKind kind() {
        return EventKind.TERNARY_OP_REQUESTED;
    }

    @Override
    public List<Handle> inputHandles() {
        return List.of(aHandle, bHandle, cHandle);
    }
}
