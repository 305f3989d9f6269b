package com.fhestream.domain;

/** Declaration order matches the program's enum index. */
public enum BinaryOperator implements FheOperator {
    AND,
    OR,
    XOR,
    ADD,
    SUB,
    SDIV,
    EQ,
    NEQ,
    GT,
    GE,
    LT,
    LE,
    MAX,
    MIN,
    MAX_OR_MIN,
    COMPARE,
    OR_VEC,
    AND_VEC,
    XOR_VEC,
    LSHIFT_L,
    SMUL_L,
    ADD_POW_TWO,
    SUB_POW_TWO,
    GATE_TEMPLETE,
    PREFIX_TEMPLETE,
    ADD_POW_TWO_TEMPLETE,
    OR_XOR,
    AND_XOR;

    @Override
    public int code() {
        return ordinal();
    }

    @Override
    public OperationType type() {
        return OperationType.BINARY;
    }
}
