package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreUnsafe(
    CoreExpr expr,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreUnsafe";
    }
}
