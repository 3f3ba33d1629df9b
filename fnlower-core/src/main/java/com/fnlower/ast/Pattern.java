package com.fnlower.ast;

public sealed interface Pattern extends Node permits
    VarPattern, WildcardPattern, LiteralPattern,
    ConstructorPattern, RecordPattern, ListPattern,
    OrPattern, TuplePattern, TypeAnnotatedPattern {
}
