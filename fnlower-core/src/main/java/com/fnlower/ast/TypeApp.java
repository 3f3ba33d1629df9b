package com.fnlower.ast;

import java.util.List;

public record TypeApp(
    TypeExpr constructor,
    List<TypeExpr> args,
    Location loc
) implements TypeExpr {
    @Override
    public String kind() {
        return "TypeApp";
    }
}
