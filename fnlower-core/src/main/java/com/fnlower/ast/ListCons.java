package com.fnlower.ast;

public record ListCons(
    Expr head,
    Expr tail,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "ListCons";
    }
}
