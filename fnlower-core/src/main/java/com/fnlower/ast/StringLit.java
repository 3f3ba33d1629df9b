package com.fnlower.ast;

public record StringLit(
    String value,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "StringLit";
    }
}
