package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreVar(
    String name,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreVar";
    }
}
