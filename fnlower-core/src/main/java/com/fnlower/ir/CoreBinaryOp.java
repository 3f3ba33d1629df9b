package com.fnlower.ir;

/**
 * Operators that survive desugaring. Cons and composition are lowered before this point.
 */
public enum CoreBinaryOp {
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    MODULO,
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_EQUAL,
    GREATER_THAN,
    GREATER_EQUAL,
    LOGICAL_AND,
    LOGICAL_OR,
    CONCAT,
    REF_ASSIGN
}
