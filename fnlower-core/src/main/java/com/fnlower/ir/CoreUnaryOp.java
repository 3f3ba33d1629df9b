package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreUnaryOp(
    CoreUnary op,
    CoreExpr expr,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreUnaryOp";
    }
}
