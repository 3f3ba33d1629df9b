package com.fnlower.ir;

import com.fnlower.ast.Location;

/**
 * Binding to a host-language value. {@code from} is null for globals.
 */
public record CoreExternalDecl(
    String name,
    CoreTypeExpr typeExpr,
    String jsName,
    String from,
    boolean exported,
    Location loc
) implements CoreDeclaration {
    @Override
    public String kind() {
        return "CoreExternalDecl";
    }
}
