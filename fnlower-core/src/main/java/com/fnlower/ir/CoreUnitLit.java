package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreUnitLit(Location loc) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreUnitLit";
    }
}
