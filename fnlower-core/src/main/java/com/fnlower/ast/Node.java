package com.fnlower.ast;

/**
 * Base interface for all surface syntax nodes produced by the parser.
 */
public sealed interface Node permits
    Expr,
    Pattern,
    TypeExpr,
    TypeDefinition,
    Declaration,
    SourceModule {

    String kind();
    Location loc();
}
