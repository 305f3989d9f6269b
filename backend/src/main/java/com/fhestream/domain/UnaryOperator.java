package com.fhestream.domain;

/** Declaration order matches the program's enum index. */
public enum UnaryOperator implements FheOperator {
    NOT,
    ABS,
    NEG;

    @Override
    public int code() {
        return ordinal();
    }

    @Override
    public OperationType type() {
        return OperationType.UNARY;
    }
}
