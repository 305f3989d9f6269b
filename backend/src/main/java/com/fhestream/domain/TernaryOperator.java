package com.fhestream.domain;

/** Declaration order matches the program's enum index. */
public enum TernaryOperator implements FheOperator {
    ADD3,
    EQ3,
    MAJ3,
    XOR3,
    SELECT;

    @Override
    public int code() {
        return ordinal();
    }

    @Override
    public OperationType type() {
        return OperationType.TERNARY;
    }
}
