package com.fnlower.ast;

public record IntLit(
    long value,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "IntLit";
    }
}
