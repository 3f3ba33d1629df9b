package com.fnlower.ir;

public sealed interface CoreExpr extends CoreNode permits
    CoreIntLit, CoreFloatLit, CoreStringLit, CoreBoolLit, CoreUnitLit,
    CoreVar, CoreLet, CoreLetRecExpr,
    CoreLambda, CoreApp, CoreMatch,
    CoreRecord, CoreRecordAccess, CoreRecordUpdate,
    CoreVariant, CoreBinOp, CoreUnaryOp,
    CoreTypeAnnotation, CoreUnsafe, CoreTuple {
}
