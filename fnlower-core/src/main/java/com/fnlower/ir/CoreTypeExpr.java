package com.fnlower.ir;

public sealed interface CoreTypeExpr extends CoreNode permits
    CoreTypeVar, CoreTypeConst, CoreTypeApp, CoreFunctionType,
    CoreRecordType, CoreVariantType, CoreUnionType, CoreTupleType {
}
