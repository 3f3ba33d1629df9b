package com.fnlower.ast;

public record BoolLit(
    boolean value,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "BoolLit";
    }
}
