package com.fnlower.ir;

/**
 * Core patterns. List, or and annotated patterns never appear here.
 */
public sealed interface CorePattern extends CoreNode permits
    CoreWildcardPattern, CoreVarPattern, CoreLiteralPattern,
    CoreVariantPattern, CoreRecordPattern, CoreTuplePattern {
}
