package com.fnlower.ast;

public enum Unary {
    NEGATE,
    LOGICAL_NOT,
    DEREF
}
