package com.fnlower.ir;

import com.fnlower.ast.Location;

/**
 * Base interface for all core IR nodes. Nodes are immutable values; passes build new trees.
 */
public sealed interface CoreNode permits
    CoreExpr,
    CorePattern,
    CoreTypeExpr,
    CoreTypeDefinition,
    CoreDeclaration,
    CoreModule {

    String kind();
    Location loc();
}
