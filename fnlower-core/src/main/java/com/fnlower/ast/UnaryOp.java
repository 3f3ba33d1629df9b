package com.fnlower.ast;

public record UnaryOp(
    Unary op,
    Expr expr,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "UnaryOp";
    }
}
