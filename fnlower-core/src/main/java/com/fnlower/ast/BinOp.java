package com.fnlower.ast;

public record BinOp(
    BinaryOp op,
    Expr left,
    Expr right,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "BinOp";
    }
}
