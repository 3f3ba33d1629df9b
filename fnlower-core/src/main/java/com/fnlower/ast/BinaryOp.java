package com.fnlower.ast;

public enum BinaryOp {
    // Arithmetic
    ADD,
    SUBTRACT,
    MULTIPLY,
    DIVIDE,
    MODULO,
    // Comparison
    EQUAL,
    NOT_EQUAL,
    LESS_THAN,
    LESS_EQUAL,
    GREATER_THAN,
    GREATER_EQUAL,
    // Logical
    LOGICAL_AND,
    LOGICAL_OR,
    // String
    CONCAT,
    // Reference
    REF_ASSIGN,
    // Sugar, never reaches the core
    CONS,
    FORWARD_COMPOSE,
    BACKWARD_COMPOSE
}
