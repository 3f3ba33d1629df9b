package com.fnlower.ast;

public record Unsafe(
    Expr expr,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "Unsafe";
    }
}
