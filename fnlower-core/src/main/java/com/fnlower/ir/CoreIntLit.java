package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreIntLit(
    long value,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreIntLit";
    }
}
