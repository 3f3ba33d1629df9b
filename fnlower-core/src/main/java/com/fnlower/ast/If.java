package com.fnlower.ast;

public record If(
    Expr condition,
    Expr thenBranch,
    Expr elseBranch,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "If";
    }
}
