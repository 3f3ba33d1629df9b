package com.fnlower.ast;

public record TypeAnnotatedPattern(
    Pattern pattern,
    TypeExpr typeExpr,
    Location loc
) implements Pattern {
    @Override
    public String kind() {
        return "TypeAnnotatedPattern";
    }
}
