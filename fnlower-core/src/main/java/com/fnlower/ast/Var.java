package com.fnlower.ast;

public record Var(
    String name,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "Var";
    }
}
