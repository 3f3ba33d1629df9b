package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreBoolLit(
    boolean value,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreBoolLit";
    }
}
