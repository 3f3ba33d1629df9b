package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreLetDecl(
    CorePattern pattern,
    CoreExpr value,
    boolean mutable,
    boolean recursive,
    boolean exported,
    Location loc
) implements CoreDeclaration {
    @Override
    public String kind() {
        return "CoreLetDecl";
    }
}
