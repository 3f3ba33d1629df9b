package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreTypeAnnotation(
    CoreExpr expr,
    CoreTypeExpr typeExpr,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreTypeAnnotation";
    }
}
