package com.fnlower.ir;

public sealed interface CoreTypeDefinition extends CoreNode permits
    CoreAliasType, CoreRecordTypeDef, CoreVariantTypeDef {
}
