package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreFloatLit(
    double value,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreFloatLit";
    }
}
