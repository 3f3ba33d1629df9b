package com.fnlower.ast;

import java.util.List;

public record FunctionType(
    List<TypeExpr> params,
    TypeExpr returnType,
    Location loc
) implements TypeExpr {
    @Override
    public String kind() {
        return "FunctionType";
    }
}
