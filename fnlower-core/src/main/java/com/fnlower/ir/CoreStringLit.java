package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreStringLit(
    String value,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreStringLit";
    }
}
