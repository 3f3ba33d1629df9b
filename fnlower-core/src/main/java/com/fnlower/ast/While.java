package com.fnlower.ast;

public record While(
    Expr condition,
    Expr body,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "While";
    }
}
