package com.fnlower.ast;

public record LetDecl(
    Pattern pattern,
    Expr value,
    boolean mutable,
    boolean recursive,
    boolean exported,
    Location loc
) implements Declaration {
    @Override
    public String kind() {
        return "LetDecl";
    }
}
