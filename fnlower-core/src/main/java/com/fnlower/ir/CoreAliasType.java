package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreAliasType(
    CoreTypeExpr typeExpr,
    Location loc
) implements CoreTypeDefinition {
    @Override
    public String kind() {
        return "CoreAliasType";
    }
}
