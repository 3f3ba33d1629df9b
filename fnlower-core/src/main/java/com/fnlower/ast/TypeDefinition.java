package com.fnlower.ast;

/**
 * Right-hand side of a {@code type} declaration.
 */
public sealed interface TypeDefinition extends Node permits AliasType, RecordTypeDef, VariantTypeDef {
}
