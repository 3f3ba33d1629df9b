package com.fnlower.ast;

import java.util.List;

public record TupleType(
    List<TypeExpr> elements,
    Location loc
) implements TypeExpr {
    @Override
    public String kind() {
        return "TupleType";
    }
}
