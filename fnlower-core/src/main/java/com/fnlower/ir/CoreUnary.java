package com.fnlower.ir;

public enum CoreUnary {
    NEGATE,
    LOGICAL_NOT,
    DEREF
}
