package com.fnlower.ast;

import java.util.List;

public record UnionType(
    List<TypeExpr> types,
    Location loc
) implements TypeExpr {
    @Override
    public String kind() {
        return "UnionType";
    }
}
