package com.fnlower.ast;

public record FloatLit(
    double value,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "FloatLit";
    }
}
