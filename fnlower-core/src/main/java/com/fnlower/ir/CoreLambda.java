package com.fnlower.ir;

import com.fnlower.ast.Location;

/**
 * Single-parameter function.
 */
public record CoreLambda(
    CorePattern param,
    CoreExpr body,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreLambda";
    }
}
