package com.fnlower.ast;

public record TypeVar(
    String name,
    Location loc
) implements TypeExpr {
    @Override
    public String kind() {
        return "TypeVar";
    }
}
