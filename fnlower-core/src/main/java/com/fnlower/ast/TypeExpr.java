package com.fnlower.ast;

public sealed interface TypeExpr extends Node permits
    TypeVar, TypeConst, TypeApp, FunctionType,
    RecordType, VariantType, UnionType, TupleType {
}
