package com.fhestream.domain;

import java.util.List;

/**
 * An operation request on existing handles producing a deterministic result handle.
 */
public sealed interface OperationEvent extends IndexedEvent permits UnaryOpRequested, BinaryOpRequested, TernaryOpRequested {

    FheOperator op();

    /** Inputs in operand order. */
    List<Handle> inputHandles();

    Handle resultHandle();

    default OperationType operationType() {
        return op().type();
    }
}
