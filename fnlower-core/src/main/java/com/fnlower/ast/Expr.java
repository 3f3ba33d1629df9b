package com.fnlower.ast;

public sealed interface Expr extends Node permits
    IntLit, FloatLit, StringLit, BoolLit, UnitLit,
    Var, Let, LetRecExpr,
    Lambda, App,
    If, Match,
    RecordLit, RecordAccess, RecordUpdate,
    ListLit, ListCons,
    BinOp, UnaryOp, Pipe,
    Block, TypeAnnotation, Unsafe, Tuple, While {
}
