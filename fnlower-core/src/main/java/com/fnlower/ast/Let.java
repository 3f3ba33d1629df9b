package com.fnlower.ast;

public record Let(
    Pattern pattern,
    Expr value,
    Expr body,
    boolean mutable,
    boolean recursive,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "Let";
    }
}
