package com.fnlower.ast;

public record TypeAnnotation(
    Expr expr,
    TypeExpr typeExpr,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "TypeAnnotation";
    }
}
