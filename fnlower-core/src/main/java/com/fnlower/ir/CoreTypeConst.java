package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreTypeConst(
    String name,
    Location loc
) implements CoreTypeExpr {
    @Override
    public String kind() {
        return "CoreTypeConst";
    }
}
