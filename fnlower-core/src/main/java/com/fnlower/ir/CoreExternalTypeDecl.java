package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreExternalTypeDecl(
    String name,
    CoreTypeExpr typeExpr,
    boolean exported,
    Location loc
) implements CoreDeclaration {
    @Override
    public String kind() {
        return "CoreExternalTypeDecl";
    }
}
