package com.fnlower.ast;

public record TypeConst(
    String name,
    Location loc
) implements TypeExpr {
    @Override
    public String kind() {
        return "TypeConst";
    }
}
